package com.bsl.dimrank.store;

/**
 * Precomputed score of a chunk on one conceptual dimension. {@code confidence} is null when
 * the extractor did not report one.
 */
public record DimensionScore(double value, Double confidence) {
    public static DimensionScore of(double value) {
        return new DimensionScore(value, null);
    }
}
