package com.bsl.dimrank.filter;

/**
 * One dimension requirement of a filter phrase. {@code threshold} is only set for
 * {@link TargetLevel#THRESHOLD} targets.
 */
public record DimensionTarget(String dimension, TargetLevel level, Double threshold) {

    public static DimensionTarget high(String dimension) {
        return new DimensionTarget(dimension, TargetLevel.HIGH, null);
    }

    public static DimensionTarget low(String dimension) {
        return new DimensionTarget(dimension, TargetLevel.LOW, null);
    }

    public static DimensionTarget atLeast(String dimension, double threshold) {
        return new DimensionTarget(dimension, TargetLevel.THRESHOLD, threshold);
    }

    /**
     * Returns true when {@code score} satisfies this target.
     */
    public boolean isSatisfiedBy(double score, double highThreshold, double lowThreshold) {
        return switch (level) {
            case HIGH -> score >= highThreshold;
            case LOW -> score <= lowThreshold;
            case THRESHOLD -> threshold == null || score >= threshold;
        };
    }
}
