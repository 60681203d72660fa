package com.bsl.dimrank.index;

import java.util.List;

public interface SimilarityIndexClient {
    List<Double> embed(String queryText);

    /**
     * Returns up to {@code count} candidates ordered by descending similarity.
     */
    List<CandidateHit> fetchCandidates(List<Double> queryEmbedding, int count);
}
