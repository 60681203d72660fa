package com.bsl.dimrank.alignment;

/**
 * Breakdown of one alignment computation. Only {@code value} is blended into the composite
 * score; the other fields feed scoring-detail logs.
 */
public record AlignmentResult(
    double value,
    double aggregate,
    double normalized,
    double confidenceBoost,
    double profileBonus,
    int dimensionsUsed,
    int penalizedTargets
) {}
