package com.bsl.dimrank.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ChunkRecord {
    private final String chunkId;
    private final String content;
    private final Map<String, DimensionScore> dimensionScores;
    private final double recencyScore;
    private final double confidenceScore;
    private final List<Double> embedding;

    public ChunkRecord(
        String chunkId,
        String content,
        Map<String, DimensionScore> dimensionScores,
        double recencyScore,
        double confidenceScore,
        List<Double> embedding
    ) {
        this.chunkId = chunkId;
        this.content = content;
        this.dimensionScores = dimensionScores == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dimensionScores));
        this.recencyScore = recencyScore;
        this.confidenceScore = confidenceScore;
        this.embedding = embedding == null ? List.of() : List.copyOf(embedding);
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getContent() {
        return content;
    }

    public Map<String, DimensionScore> getDimensionScores() {
        return dimensionScores;
    }

    public double getRecencyScore() {
        return recencyScore;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public List<Double> getEmbedding() {
        return embedding;
    }
}
