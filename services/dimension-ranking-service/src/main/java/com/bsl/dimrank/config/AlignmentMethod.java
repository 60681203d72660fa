package com.bsl.dimrank.config;

public enum AlignmentMethod {
    MIN,
    MAX,
    AVERAGE,
    WEIGHTED_AVERAGE;

    public static AlignmentMethod from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "min" -> MIN;
            case "max" -> MAX;
            case "average", "avg", "mean" -> AVERAGE;
            case "weighted_average", "weighted" -> WEIGHTED_AVERAGE;
            default -> null;
        };
    }
}
