package com.bsl.dimrank.config;

import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterMapping;
import com.bsl.dimrank.profile.Profile;
import com.bsl.dimrank.profile.ProfileRegistry;
import com.bsl.dimrank.profile.ProfileWeights;
import com.bsl.dimrank.profile.ScoringFactor;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Exhaustive validation of a {@link RetrievalConfig}. The first violation fails the whole
 * configuration; nothing is normalized or skipped.
 */
public final class RetrievalConfigValidator {
    private RetrievalConfigValidator() {}

    public static void validate(RetrievalConfig config) {
        if (config == null) {
            throw new ConfigurationException("retrieval config missing");
        }
        validateRetrieval(config.getRetrieval());
        validateProfiles(config.getProfiles());
        validateFilters(config.getFilters());
        validateDetection(config.getDetection());
        validateAlignment(config.getAlignment());
        validateCaching(config.getCaching());
        if (config.getLogging() == null) {
            throw new ConfigurationException("logging settings missing");
        }
    }

    private static void validateRetrieval(RetrievalConfig.RetrievalSettings retrieval) {
        if (retrieval == null) {
            throw new ConfigurationException("retrieval settings missing");
        }
        if (retrieval.defaultStrategy() == null) {
            throw new ConfigurationException("default_strategy required");
        }
        if (retrieval.maxCandidatesMultiplier() < 1) {
            throw new ConfigurationException("max_candidates_multiplier must be >= 1");
        }
        if (retrieval.minCandidates() < 0) {
            throw new ConfigurationException("min_candidates must be >= 0");
        }
        if (retrieval.maxProcessingTimeMs() <= 0) {
            throw new ConfigurationException("max_processing_time_ms must be > 0");
        }
        RetrievalStrategy fallback = retrieval.fallbackStrategy();
        if (fallback != RetrievalStrategy.VECTOR_ONLY && fallback != RetrievalStrategy.DIMENSION_ONLY) {
            throw new ConfigurationException("fallback_strategy must be vector_only or dimension_only");
        }
        RetrievalConfig.AdaptiveSettings adaptive = retrieval.adaptive();
        if (adaptive == null || adaptive.consecutiveTimeouts() < 1 || adaptive.cooldownMs() <= 0) {
            throw new ConfigurationException("adaptive settings require consecutive_timeouts >= 1 and cooldown_ms > 0");
        }
    }

    private static void validateProfiles(ProfileRegistry registry) {
        if (registry == null || registry.size() == 0) {
            throw new ConfigurationException("at least one profile required");
        }
        if (registry.get(ProfileRegistry.DEFAULT_PROFILE_ID).isEmpty()) {
            throw new ConfigurationException("default profile '" + ProfileRegistry.DEFAULT_PROFILE_ID + "' required");
        }
        Set<String> ids = new HashSet<>();
        for (Profile profile : registry.profiles()) {
            if (profile.getId() == null || profile.getId().isBlank()) {
                throw new ConfigurationException("profile id required");
            }
            if (!ids.add(profile.getId())) {
                throw new ConfigurationException("duplicate profile: " + profile.getId());
            }
            ProfileWeights weights = profile.getWeights();
            if (weights == null) {
                throw new ConfigurationException("profile weights required: " + profile.getId());
            }
            for (ScoringFactor factor : ScoringFactor.values()) {
                double weight = weights.get(factor);
                if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
                    throw new ConfigurationException(
                        "weight " + factor.key() + " out of range [0,1] in profile " + profile.getId()
                    );
                }
            }
            if (!weights.sumsToOne()) {
                throw new ConfigurationException(
                    "weights of profile " + profile.getId() + " sum to " + weights.sum() + ", expected 1.0"
                );
            }
            for (Map.Entry<String, Double> dimension : profile.getDimensions().entrySet()) {
                Double multiplier = dimension.getValue();
                if (multiplier == null || multiplier.isNaN() || multiplier.isInfinite() || multiplier <= 0.0) {
                    throw new ConfigurationException(
                        "multiplier for " + dimension.getKey() + " must be > 0 in profile " + profile.getId()
                    );
                }
            }
        }
    }

    private static void validateFilters(RetrievalConfig.FilterSettings filters) {
        if (filters == null) {
            throw new ConfigurationException("filter settings missing");
        }
        requireUnit("natural_language_filters.confidence_threshold", filters.confidenceThreshold());
        requireUnit("natural_language_filters.filter_strength", filters.filterStrength());
        requireUnit("natural_language_filters.high_threshold", filters.highThreshold());
        requireUnit("natural_language_filters.low_threshold", filters.lowThreshold());
        requireUnit("natural_language_filters.base_confidence", filters.baseConfidence());
        Set<String> phrases = new HashSet<>();
        for (FilterMapping mapping : filters.mappings()) {
            if (!phrases.add(mapping.phrase().toLowerCase())) {
                throw new ConfigurationException("duplicate filter phrase: " + mapping.phrase());
            }
            if (mapping.confidence() != null) {
                requireUnit("confidence of phrase '" + mapping.phrase() + "'", mapping.confidence());
            }
            for (DimensionTarget target : mapping.targets()) {
                if (target.threshold() != null) {
                    requireUnit("threshold of " + target.dimension() + " in '" + mapping.phrase() + "'", target.threshold());
                }
            }
        }
    }

    private static void validateDetection(RetrievalConfig.DetectionSettings detection) {
        if (detection == null) {
            throw new ConfigurationException("auto profile detection settings missing");
        }
        requireUnit("auto_profile_detection.confidence_threshold", detection.confidenceThreshold());
    }

    private static void validateAlignment(RetrievalConfig.AlignmentSettings alignment) {
        if (alignment == null || alignment.method() == null || alignment.normalization() == null) {
            throw new ConfigurationException("dimension_alignment method and normalization required");
        }
        RetrievalConfig.ConfidenceBoost boost = alignment.confidenceBoost();
        if (boost == null) {
            throw new ConfigurationException("confidence_boost settings missing");
        }
        requireUnit("confidence_boost.max_boost", boost.maxBoost());
        requireUnit("confidence_boost.threshold", boost.threshold());
        RetrievalConfig.ProfileBonus bonus = alignment.profileBonus();
        if (bonus == null) {
            throw new ConfigurationException("profile_bonus settings missing");
        }
        requireUnit("profile_bonus.same_profile_bonus", bonus.sameProfileBonus());
        requireUnit("profile_bonus.cross_profile_penalty", bonus.crossProfilePenalty());
    }

    private static void validateCaching(RetrievalConfig.CacheSettings caching) {
        if (caching == null) {
            throw new ConfigurationException("caching settings missing");
        }
        if (caching.cacheSize() < 1) {
            throw new ConfigurationException("caching.cache_size must be >= 1");
        }
        if (caching.queryCacheSize() < 1) {
            throw new ConfigurationException("caching.query_cache_size must be >= 1");
        }
        if (caching.cacheTtlSeconds() <= 0) {
            throw new ConfigurationException("caching.cache_ttl must be > 0");
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0,1]: " + value);
        }
    }
}
