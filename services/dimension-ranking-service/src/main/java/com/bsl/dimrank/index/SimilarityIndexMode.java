package com.bsl.dimrank.index;

public enum SimilarityIndexMode {
    LOCAL,
    HTTP
}
