package com.bsl.dimrank.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity-index")
public class SimilarityIndexProperties {
    private SimilarityIndexMode mode = SimilarityIndexMode.LOCAL;
    private String baseUrl;
    private int timeoutMs = 150;
    private String collection;

    public SimilarityIndexMode getMode() {
        return mode;
    }

    public void setMode(SimilarityIndexMode mode) {
        this.mode = mode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }
}
