package com.bsl.dimrank.store;

import java.util.Map;

/**
 * Read-only view of the storage collaborator that owns chunks and their precomputed
 * dimension metadata. Unknown chunks yield empty scores and zero recency/confidence.
 */
public interface ChunkStoreClient {
    Map<String, DimensionScore> getDimensionScores(String chunkId);

    double getRecency(String chunkId);

    double getConfidence(String chunkId);
}
