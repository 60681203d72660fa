package com.bsl.dimrank.service;

import com.bsl.dimrank.filter.FilterConstraint;
import java.util.List;

/**
 * Outcome of one ranking call. {@code degraded} is set whenever the result did not go through
 * the full configured pipeline (fallback, timeout or adaptive downgrade).
 */
public record RankResult(
    List<ScoredCandidate> results,
    String profileUsed,
    double profileConfidence,
    boolean degraded,
    RankingState state,
    ExecutionMode mode,
    List<String> reasonCodes,
    List<FilterConstraint> constraints,
    int candidatesFetched,
    int candidatesScored,
    int cacheHits,
    int cacheMisses,
    long tookMs
) {
    public RankResult {
        results = results == null ? List.of() : List.copyOf(results);
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
