package com.bsl.dimrank.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class RankResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    @JsonProperty("profile_used")
    private String profileUsed;

    @JsonProperty("profile_confidence")
    private double profileConfidence;

    private boolean degraded;
    private String state;
    private String mode;

    @JsonProperty("reason_codes")
    private List<String> reasonCodes;

    private List<Constraint> constraints;
    private List<Hit> results;
    private Stats stats;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public String getProfileUsed() {
        return profileUsed;
    }

    public void setProfileUsed(String profileUsed) {
        this.profileUsed = profileUsed;
    }

    public double getProfileConfidence() {
        return profileConfidence;
    }

    public void setProfileConfidence(double profileConfidence) {
        this.profileConfidence = profileConfidence;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public List<String> getReasonCodes() {
        return reasonCodes;
    }

    public void setReasonCodes(List<String> reasonCodes) {
        this.reasonCodes = reasonCodes;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public void setConstraints(List<Constraint> constraints) {
        this.constraints = constraints;
    }

    public List<Hit> getResults() {
        return results;
    }

    public void setResults(List<Hit> results) {
        this.results = results;
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats;
    }

    public static class Hit {
        @JsonProperty("chunk_id")
        private String chunkId;

        private int rank;
        private double score;

        @JsonProperty("semantic_similarity")
        private double semanticSimilarity;

        @JsonProperty("dimension_alignment")
        private double dimensionAlignment;

        @JsonProperty("recency_score")
        private double recencyScore;

        @JsonProperty("confidence_score")
        private double confidenceScore;

        @JsonProperty("similarity_rank")
        private int similarityRank;

        @JsonProperty("dimension_scored")
        private boolean dimensionScored;

        public String getChunkId() {
            return chunkId;
        }

        public void setChunkId(String chunkId) {
            this.chunkId = chunkId;
        }

        public int getRank() {
            return rank;
        }

        public void setRank(int rank) {
            this.rank = rank;
        }

        public double getScore() {
            return score;
        }

        public void setScore(double score) {
            this.score = score;
        }

        public double getSemanticSimilarity() {
            return semanticSimilarity;
        }

        public void setSemanticSimilarity(double semanticSimilarity) {
            this.semanticSimilarity = semanticSimilarity;
        }

        public double getDimensionAlignment() {
            return dimensionAlignment;
        }

        public void setDimensionAlignment(double dimensionAlignment) {
            this.dimensionAlignment = dimensionAlignment;
        }

        public double getRecencyScore() {
            return recencyScore;
        }

        public void setRecencyScore(double recencyScore) {
            this.recencyScore = recencyScore;
        }

        public double getConfidenceScore() {
            return confidenceScore;
        }

        public void setConfidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
        }

        public int getSimilarityRank() {
            return similarityRank;
        }

        public void setSimilarityRank(int similarityRank) {
            this.similarityRank = similarityRank;
        }

        public boolean isDimensionScored() {
            return dimensionScored;
        }

        public void setDimensionScored(boolean dimensionScored) {
            this.dimensionScored = dimensionScored;
        }
    }

    public static class Constraint {
        private String phrase;
        private double confidence;
        private List<Target> targets;

        public String getPhrase() {
            return phrase;
        }

        public void setPhrase(String phrase) {
            this.phrase = phrase;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public List<Target> getTargets() {
            return targets;
        }

        public void setTargets(List<Target> targets) {
            this.targets = targets;
        }
    }

    public static class Target {
        private String dimension;
        private String level;
        private Double threshold;

        public String getDimension() {
            return dimension;
        }

        public void setDimension(String dimension) {
            this.dimension = dimension;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }

        public Double getThreshold() {
            return threshold;
        }

        public void setThreshold(Double threshold) {
            this.threshold = threshold;
        }
    }

    public static class Stats {
        @JsonProperty("candidates_fetched")
        private int candidatesFetched;

        @JsonProperty("candidates_scored")
        private int candidatesScored;

        @JsonProperty("cache_hits")
        private int cacheHits;

        @JsonProperty("cache_misses")
        private int cacheMisses;

        public int getCandidatesFetched() {
            return candidatesFetched;
        }

        public void setCandidatesFetched(int candidatesFetched) {
            this.candidatesFetched = candidatesFetched;
        }

        public int getCandidatesScored() {
            return candidatesScored;
        }

        public void setCandidatesScored(int candidatesScored) {
            this.candidatesScored = candidatesScored;
        }

        public int getCacheHits() {
            return cacheHits;
        }

        public void setCacheHits(int cacheHits) {
            this.cacheHits = cacheHits;
        }

        public int getCacheMisses() {
            return cacheMisses;
        }

        public void setCacheMisses(int cacheMisses) {
            this.cacheMisses = cacheMisses;
        }
    }
}
