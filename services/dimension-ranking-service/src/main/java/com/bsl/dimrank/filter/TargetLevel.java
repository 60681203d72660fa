package com.bsl.dimrank.filter;

public enum TargetLevel {
    LOW,
    HIGH,
    THRESHOLD;

    public static TargetLevel from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "low" -> LOW;
            case "high" -> HIGH;
            default -> null;
        };
    }
}
