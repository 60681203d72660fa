package com.bsl.dimrank.profile;

public enum ScoringFactor {
    SEMANTIC_SIMILARITY("semantic_similarity"),
    DIMENSION_ALIGNMENT("dimension_alignment"),
    RECENCY_SCORE("recency_score"),
    CONFIDENCE_SCORE("confidence_score");

    private final String key;

    ScoringFactor(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static ScoringFactor from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (ScoringFactor factor : values()) {
            if (factor.key.equals(normalized)) {
                return factor;
            }
        }
        return null;
    }
}
