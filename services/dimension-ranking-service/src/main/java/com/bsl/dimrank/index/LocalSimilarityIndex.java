package com.bsl.dimrank.index;

import com.bsl.dimrank.store.ChunkRecord;
import com.bsl.dimrank.store.LocalChunkStoreClient;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * In-process index over the chunks of the local store. Chunks without a stored embedding are
 * embedded from their content with {@link HashingEmbedder}.
 */
@Component
public class LocalSimilarityIndex implements SimilarityIndexClient {
    private final LocalChunkStoreClient chunkStore;
    private final HashingEmbedder embedder;

    public LocalSimilarityIndex(LocalChunkStoreClient chunkStore, HashingEmbedder embedder) {
        this.chunkStore = chunkStore;
        this.embedder = embedder;
    }

    @Override
    public List<Double> embed(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new CandidateFetchException("embed_empty_text");
        }
        return embedder.embed(queryText);
    }

    @Override
    public List<CandidateHit> fetchCandidates(List<Double> queryEmbedding, int count) {
        if (queryEmbedding == null || queryEmbedding.isEmpty()) {
            throw new CandidateFetchException("fetch_empty_embedding");
        }
        if (count <= 0) {
            return List.of();
        }
        List<CandidateHit> hits = new ArrayList<>();
        for (ChunkRecord chunk : chunkStore.all()) {
            List<Double> vector = chunk.getEmbedding().isEmpty() ? embedder.embed(chunk.getContent()) : chunk.getEmbedding();
            if (vector.size() != queryEmbedding.size()) {
                continue;
            }
            hits.add(new CandidateHit(chunk.getChunkId(), cosine(queryEmbedding, vector)));
        }
        hits.sort(
            Comparator.comparingDouble(CandidateHit::similarity).reversed()
                .thenComparing(CandidateHit::chunkId)
        );
        return hits.size() <= count ? hits : new ArrayList<>(hits.subList(0, count));
    }

    static double cosine(List<Double> left, List<Double> right) {
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.size(); i++) {
            double a = left.get(i) == null ? 0.0 : left.get(i);
            double b = right.get(i) == null ? 0.0 : right.get(i);
            dot += a * b;
            leftNorm += a * a;
            rightNorm += b * b;
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
