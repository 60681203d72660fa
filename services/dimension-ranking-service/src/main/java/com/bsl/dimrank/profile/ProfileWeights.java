package com.bsl.dimrank.profile;

public record ProfileWeights(
    double semanticSimilarity,
    double dimensionAlignment,
    double recencyScore,
    double confidenceScore
) {
    public static final double SUM_TOLERANCE = 1e-6;

    public double get(ScoringFactor factor) {
        return switch (factor) {
            case SEMANTIC_SIMILARITY -> semanticSimilarity;
            case DIMENSION_ALIGNMENT -> dimensionAlignment;
            case RECENCY_SCORE -> recencyScore;
            case CONFIDENCE_SCORE -> confidenceScore;
        };
    }

    public double sum() {
        return semanticSimilarity + dimensionAlignment + recencyScore + confidenceScore;
    }

    public boolean sumsToOne() {
        return Math.abs(sum() - 1.0) <= SUM_TOLERANCE;
    }
}
