package com.bsl.dimrank.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dimrank.guardrails")
public class RankGuardrailsProperties {
    private int defaultResultCount = 10;
    private int maxResultCount = 100;
    private int maxCandidates = 1000;
    private int maxQueryLength = 2000;

    public int getDefaultResultCount() {
        return defaultResultCount;
    }

    public void setDefaultResultCount(int defaultResultCount) {
        this.defaultResultCount = defaultResultCount;
    }

    public int getMaxResultCount() {
        return maxResultCount;
    }

    public void setMaxResultCount(int maxResultCount) {
        this.maxResultCount = maxResultCount;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }
}
