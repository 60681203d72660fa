package com.bsl.dimrank.cache;

import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalConfigService;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Memoizes alignment values per (config generation, profile id, constraints fingerprint,
 * chunk id). Shared by all concurrent queries.
 */
@Component
public class AlignmentScoreCache {
    private final TtlCache<Double> cache;

    public AlignmentScoreCache(RetrievalConfigService configService, Clock clock) {
        RetrievalConfig.CacheSettings settings = configService.current().getCaching();
        this.cache = new TtlCache<>(settings.cacheSize(), settings.cacheTtlSeconds() * 1000L, clock);
    }

    public Optional<Double> get(long generation, String constraintsFingerprint, String chunkId, String profileId) {
        try {
            return cache.get(buildKey(generation, constraintsFingerprint, chunkId, profileId)).map(CacheEntry::getValue);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("alignment cache lookup failed", ex);
        }
    }

    public void put(long generation, String constraintsFingerprint, String chunkId, String profileId, double alignment) {
        try {
            cache.put(buildKey(generation, constraintsFingerprint, chunkId, profileId), alignment);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("alignment cache insert failed", ex);
        }
    }

    public int size() {
        return cache.size();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private String buildKey(long generation, String constraintsFingerprint, String chunkId, String profileId) {
        String resolvedConstraints = constraintsFingerprint == null || constraintsFingerprint.isBlank()
            ? "none"
            : constraintsFingerprint;
        String resolvedChunk = chunkId == null || chunkId.isBlank() ? "na" : chunkId;
        String resolvedProfile = profileId == null || profileId.isBlank() ? "default" : profileId;
        return "align:" + generation + ":" + resolvedProfile + ":" + resolvedConstraints + ":" + resolvedChunk;
    }
}
