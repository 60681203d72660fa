package com.bsl.dimrank.config;

public enum RetrievalStrategy {
    VECTOR_ONLY,
    DIMENSION_ONLY,
    HYBRID,
    ADAPTIVE;

    public static RetrievalStrategy from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "vector_only", "vector" -> VECTOR_ONLY;
            case "dimension_only", "dimension" -> DIMENSION_ONLY;
            case "hybrid" -> HYBRID;
            case "adaptive" -> ADAPTIVE;
            default -> null;
        };
    }
}
