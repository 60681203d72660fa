package com.bsl.dimrank.cache;

import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalConfigService;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class QueryEmbeddingCache {
    private final TtlCache<List<Double>> cache;

    public QueryEmbeddingCache(RetrievalConfigService configService, Clock clock) {
        RetrievalConfig.CacheSettings settings = configService.current().getCaching();
        this.cache = new TtlCache<>(settings.queryCacheSize(), settings.cacheTtlSeconds() * 1000L, clock);
    }

    public Optional<List<Double>> get(long generation, String fingerprint) {
        try {
            return cache.get(buildKey(generation, fingerprint)).map(CacheEntry::getValue);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("query embedding cache lookup failed", ex);
        }
    }

    public void put(long generation, String fingerprint, List<Double> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            return;
        }
        try {
            cache.put(buildKey(generation, fingerprint), List.copyOf(embedding));
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("query embedding cache insert failed", ex);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private String buildKey(long generation, String fingerprint) {
        return "embed:" + generation + ":" + (fingerprint == null || fingerprint.isBlank() ? "na" : fingerprint);
    }
}
