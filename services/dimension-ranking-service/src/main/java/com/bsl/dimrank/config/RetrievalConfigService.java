package com.bsl.dimrank.config;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the active {@link RetrievalConfig} snapshot. Readers take the snapshot once per query;
 * a reload validates the new configuration completely before swapping it in, so in-flight
 * queries see either the old or the new configuration and never a mix.
 */
@Component
public class RetrievalConfigService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalConfigService.class);

    private final RetrievalConfigLoader loader;
    private final RetrievalConfigProperties properties;
    private final AtomicReference<RetrievalConfig> current = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();

    public RetrievalConfigService(RetrievalConfigLoader loader, RetrievalConfigProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        RetrievalConfig loaded = loader.load(properties.getPath()).withGeneration(generations.incrementAndGet());
        current.set(loaded);
        log.info(
            "retrieval config active strategy={} profiles={} generation={}",
            loaded.getRetrieval().defaultStrategy(),
            loaded.getProfiles().size(),
            loaded.getGeneration()
        );
    }

    public RetrievalConfig current() {
        RetrievalConfig config = current.get();
        if (config == null) {
            throw new IllegalStateException("retrieval config not loaded");
        }
        return config;
    }

    /**
     * Loads and validates the configuration again. On failure the previous snapshot stays active
     * and the {@link ConfigurationException} is rethrown.
     */
    public RetrievalConfig reload() {
        RetrievalConfig loaded;
        try {
            loaded = loader.load(properties.getPath()).withGeneration(generations.incrementAndGet());
        } catch (ConfigurationException ex) {
            log.warn("retrieval config reload rejected: {}", ex.getMessage());
            throw ex;
        }
        current.set(loaded);
        log.info("retrieval config reloaded profiles={} generation={}", loaded.getProfiles().size(), loaded.getGeneration());
        return loaded;
    }
}
