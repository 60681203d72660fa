package com.bsl.dimrank.service;

public enum ExecutionMode {
    HYBRID,
    DIMENSION_ONLY,
    VECTOR_ONLY
}
