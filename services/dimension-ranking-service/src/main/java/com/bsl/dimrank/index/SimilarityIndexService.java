package com.bsl.dimrank.index;

import java.util.List;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Routes index calls to the local index or the remote gateway according to
 * {@code similarity-index.mode}.
 */
@Primary
@Component
public class SimilarityIndexService implements SimilarityIndexClient {
    private final SimilarityIndexProperties properties;
    private final LocalSimilarityIndex localIndex;
    private final SimilarityIndexGateway gateway;

    public SimilarityIndexService(
        SimilarityIndexProperties properties,
        LocalSimilarityIndex localIndex,
        SimilarityIndexGateway gateway
    ) {
        this.properties = properties;
        this.localIndex = localIndex;
        this.gateway = gateway;
    }

    @Override
    public List<Double> embed(String queryText) {
        return delegate().embed(queryText);
    }

    @Override
    public List<CandidateHit> fetchCandidates(List<Double> queryEmbedding, int count) {
        return delegate().fetchCandidates(queryEmbedding, count);
    }

    private SimilarityIndexClient delegate() {
        return properties.getMode() == SimilarityIndexMode.HTTP ? gateway : localIndex;
    }
}
