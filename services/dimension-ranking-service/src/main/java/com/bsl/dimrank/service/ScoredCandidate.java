package com.bsl.dimrank.service;

public record ScoredCandidate(
    String chunkId,
    int similarityRank,
    double semanticSimilarity,
    double dimensionAlignment,
    double recencyScore,
    double confidenceScore,
    String profileId,
    double score,
    boolean dimensionScored
) {}
