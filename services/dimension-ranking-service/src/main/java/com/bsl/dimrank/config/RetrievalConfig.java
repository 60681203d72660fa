package com.bsl.dimrank.config;

import com.bsl.dimrank.filter.FilterMapping;
import com.bsl.dimrank.profile.ProfileRegistry;
import java.util.List;

/**
 * Immutable snapshot of the dimension-aware retrieval configuration. Instances are only
 * produced by {@link RetrievalConfigLoader} after {@link RetrievalConfigValidator} accepted
 * them, and are swapped as a whole on reload. {@link RetrievalConfigService} stamps every
 * installed snapshot with a new {@code generation}; cache keys carry it so values computed
 * under one snapshot are never served to queries holding another.
 */
public final class RetrievalConfig {
    private final RetrievalSettings retrieval;
    private final ProfileRegistry profiles;
    private final FilterSettings filters;
    private final DetectionSettings detection;
    private final AlignmentSettings alignment;
    private final CacheSettings caching;
    private final LoggingSettings logging;
    private final long generation;

    public RetrievalConfig(
        RetrievalSettings retrieval,
        ProfileRegistry profiles,
        FilterSettings filters,
        DetectionSettings detection,
        AlignmentSettings alignment,
        CacheSettings caching,
        LoggingSettings logging
    ) {
        this(retrieval, profiles, filters, detection, alignment, caching, logging, 0L);
    }

    private RetrievalConfig(
        RetrievalSettings retrieval,
        ProfileRegistry profiles,
        FilterSettings filters,
        DetectionSettings detection,
        AlignmentSettings alignment,
        CacheSettings caching,
        LoggingSettings logging,
        long generation
    ) {
        this.retrieval = retrieval;
        this.profiles = profiles;
        this.filters = filters;
        this.detection = detection;
        this.alignment = alignment;
        this.caching = caching;
        this.logging = logging;
        this.generation = generation;
    }

    public RetrievalConfig withGeneration(long generation) {
        return new RetrievalConfig(retrieval, profiles, filters, detection, alignment, caching, logging, generation);
    }

    public long getGeneration() {
        return generation;
    }

    public RetrievalSettings getRetrieval() {
        return retrieval;
    }

    public ProfileRegistry getProfiles() {
        return profiles;
    }

    public FilterSettings getFilters() {
        return filters;
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public AlignmentSettings getAlignment() {
        return alignment;
    }

    public CacheSettings getCaching() {
        return caching;
    }

    public LoggingSettings getLogging() {
        return logging;
    }

    public record RetrievalSettings(
        boolean enableDimensionRanking,
        RetrievalStrategy defaultStrategy,
        int maxCandidatesMultiplier,
        int minCandidates,
        long maxProcessingTimeMs,
        boolean enableFallback,
        RetrievalStrategy fallbackStrategy,
        AdaptiveSettings adaptive
    ) {
        public static RetrievalSettings defaults() {
            return new RetrievalSettings(
                true,
                RetrievalStrategy.HYBRID,
                4,
                20,
                200L,
                true,
                RetrievalStrategy.VECTOR_ONLY,
                AdaptiveSettings.defaults()
            );
        }
    }

    public record AdaptiveSettings(int consecutiveTimeouts, long cooldownMs) {
        public static AdaptiveSettings defaults() {
            return new AdaptiveSettings(3, 30_000L);
        }
    }

    public record FilterSettings(
        boolean enableParsing,
        double confidenceThreshold,
        double filterStrength,
        double highThreshold,
        double lowThreshold,
        double baseConfidence,
        List<FilterMapping> mappings
    ) {
        public FilterSettings {
            mappings = mappings == null ? List.of() : List.copyOf(mappings);
        }

        public static FilterSettings defaults() {
            return new FilterSettings(true, 0.6, 0.5, 0.5, 0.5, 0.8, List.of());
        }
    }

    public record DetectionSettings(boolean enabled, double confidenceThreshold) {
        public static DetectionSettings defaults() {
            return new DetectionSettings(true, 0.7);
        }
    }

    public record AlignmentSettings(
        AlignmentMethod method,
        NormalizationMode normalization,
        ConfidenceBoost confidenceBoost,
        ProfileBonus profileBonus
    ) {
        public static AlignmentSettings defaults() {
            return new AlignmentSettings(
                AlignmentMethod.MIN,
                NormalizationMode.TOTAL_WEIGHT,
                ConfidenceBoost.defaults(),
                ProfileBonus.defaults()
            );
        }
    }

    public record ConfidenceBoost(boolean enabled, double maxBoost, double threshold) {
        public static ConfidenceBoost defaults() {
            return new ConfidenceBoost(true, 0.1, 0.5);
        }
    }

    public record ProfileBonus(boolean enabled, double sameProfileBonus, double crossProfilePenalty) {
        public static ProfileBonus defaults() {
            return new ProfileBonus(true, 0.05, 0.0);
        }
    }

    public record CacheSettings(
        boolean enableDimensionCache,
        int cacheSize,
        long cacheTtlSeconds,
        boolean enableQueryCache,
        int queryCacheSize
    ) {
        public static CacheSettings defaults() {
            return new CacheSettings(true, 1000, 3600L, true, 100);
        }
    }

    public record LoggingSettings(boolean logScoringDetails, boolean logPerformance, boolean logFilters) {
        public static LoggingSettings defaults() {
            return new LoggingSettings(false, true, false);
        }
    }
}
