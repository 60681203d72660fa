package com.bsl.dimrank.config;

public enum NormalizationMode {
    NONE,
    TOTAL_WEIGHT,
    MAX_WEIGHT;

    public static NormalizationMode from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "none" -> NONE;
            case "total_weight" -> TOTAL_WEIGHT;
            case "max_weight" -> MAX_WEIGHT;
            default -> null;
        };
    }
}
