package com.bsl.dimrank.config;

import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterMapping;
import com.bsl.dimrank.filter.TargetLevel;
import com.bsl.dimrank.profile.Profile;
import com.bsl.dimrank.profile.ProfileRegistry;
import com.bsl.dimrank.profile.ProfileWeights;
import com.bsl.dimrank.profile.ScoringFactor;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

@Component
public class RetrievalConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(RetrievalConfigLoader.class);

    public RetrievalConfig load(String path) {
        Path resolved = resolvePath(path);
        if (!Files.exists(resolved)) {
            throw new ConfigurationException("retrieval config not found at " + path);
        }
        Object parsed;
        try (InputStream input = Files.newInputStream(resolved)) {
            parsed = new Yaml().load(input);
        } catch (IOException | YAMLException ex) {
            throw new ConfigurationException("retrieval config load failed: " + path, ex);
        }
        RetrievalConfig config = fromRoot(parsed);
        log.info("retrieval config loaded path={} profiles={}", resolved, config.getProfiles().size());
        return config;
    }

    public RetrievalConfig parse(String yamlText) {
        Object parsed;
        try {
            parsed = new Yaml().load(yamlText);
        } catch (YAMLException ex) {
            throw new ConfigurationException("retrieval config malformed", ex);
        }
        return fromRoot(parsed);
    }

    private RetrievalConfig fromRoot(Object parsed) {
        if (!(parsed instanceof Map<?, ?> root)) {
            throw new ConfigurationException("retrieval config malformed (root not map)");
        }
        RetrievalConfig.RetrievalSettings retrieval = parseRetrieval(section(root, "retrieval"));
        RetrievalConfig.DetectionSettings detection = parseDetection(section(root, "auto_profile_detection"));
        Map<String, List<Pattern>> patterns = parsePatterns(section(root, "auto_profile_detection"));
        ProfileRegistry profiles = parseProfiles(root.get("profiles"), patterns);
        RetrievalConfig.FilterSettings filters = parseFilters(section(root, "natural_language_filters"));
        RetrievalConfig.AlignmentSettings alignment = parseAlignment(section(root, "dimension_alignment"));
        RetrievalConfig.CacheSettings caching = parseCaching(section(root, "caching"));
        RetrievalConfig.LoggingSettings logging = parseLogging(section(root, "logging"));

        RetrievalConfig config = new RetrievalConfig(retrieval, profiles, filters, detection, alignment, caching, logging);
        RetrievalConfigValidator.validate(config);
        return config;
    }

    private RetrievalConfig.RetrievalSettings parseRetrieval(Map<?, ?> map) {
        RetrievalConfig.RetrievalSettings defaults = RetrievalConfig.RetrievalSettings.defaults();
        Map<?, ?> adaptiveMap = section(map, "adaptive");
        RetrievalConfig.AdaptiveSettings adaptiveDefaults = RetrievalConfig.AdaptiveSettings.defaults();
        RetrievalConfig.AdaptiveSettings adaptive = new RetrievalConfig.AdaptiveSettings(
            asInt(adaptiveMap, "consecutive_timeouts", adaptiveDefaults.consecutiveTimeouts()),
            asLong(adaptiveMap, "cooldown_ms", adaptiveDefaults.cooldownMs())
        );
        return new RetrievalConfig.RetrievalSettings(
            asBoolean(map, "enable_dimension_ranking", defaults.enableDimensionRanking()),
            asStrategy(map, "default_strategy", defaults.defaultStrategy()),
            asInt(map, "max_candidates_multiplier", defaults.maxCandidatesMultiplier()),
            asInt(map, "min_candidates", defaults.minCandidates()),
            asLong(map, "max_processing_time_ms", defaults.maxProcessingTimeMs()),
            asBoolean(map, "enable_fallback", defaults.enableFallback()),
            asStrategy(map, "fallback_strategy", defaults.fallbackStrategy()),
            adaptive
        );
    }

    private ProfileRegistry parseProfiles(Object raw, Map<String, List<Pattern>> patterns) {
        if (!(raw instanceof Map<?, ?> map) || map.isEmpty()) {
            throw new ConfigurationException("profiles section required");
        }
        List<Profile> profiles = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String id = asString(entry.getKey(), null);
            if (id == null) {
                throw new ConfigurationException("profile id required");
            }
            if (!(entry.getValue() instanceof Map<?, ?> body)) {
                throw new ConfigurationException("profile body must be a map: " + id);
            }
            profiles.add(parseProfile(id, body, patterns.get(id)));
        }
        for (String patternProfile : patterns.keySet()) {
            if (!map.containsKey(patternProfile)) {
                throw new ConfigurationException("detection patterns reference unknown profile: " + patternProfile);
            }
        }
        return new ProfileRegistry(profiles);
    }

    private Profile parseProfile(String id, Map<?, ?> body, List<Pattern> patterns) {
        Map<?, ?> weightsMap = section(body, "weights");
        if (weightsMap.isEmpty()) {
            throw new ConfigurationException("profile weights required: " + id);
        }
        for (Object key : weightsMap.keySet()) {
            if (ScoringFactor.from(String.valueOf(key)) == null) {
                throw new ConfigurationException("unknown weight factor '" + key + "' in profile " + id);
            }
        }
        ProfileWeights weights = new ProfileWeights(
            asDouble(weightsMap, ScoringFactor.SEMANTIC_SIMILARITY.key(), 0.0),
            asDouble(weightsMap, ScoringFactor.DIMENSION_ALIGNMENT.key(), 0.0),
            asDouble(weightsMap, ScoringFactor.RECENCY_SCORE.key(), 0.0),
            asDouble(weightsMap, ScoringFactor.CONFIDENCE_SCORE.key(), 0.0)
        );

        Map<String, Double> dimensions = new LinkedHashMap<>();
        Map<?, ?> dimensionMap = section(body, "dimensions");
        for (Map.Entry<?, ?> dimension : dimensionMap.entrySet()) {
            String name = asString(dimension.getKey(), null);
            Double multiplier = toDouble(dimension.getValue());
            if (name == null || multiplier == null) {
                throw new ConfigurationException("invalid dimension multiplier in profile " + id + ": " + dimension.getKey());
            }
            dimensions.put(name, multiplier);
        }

        List<String> targetUsers = new ArrayList<>();
        if (body.get("target_users") instanceof List<?> users) {
            for (Object user : users) {
                String value = asString(user, null);
                if (value != null) {
                    targetUsers.add(value);
                }
            }
        }
        return new Profile(id, asString(body.get("description"), null), targetUsers, weights, dimensions, patterns);
    }

    private Map<String, List<Pattern>> parsePatterns(Map<?, ?> detectionMap) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        Map<?, ?> patternMap = section(detectionMap, "patterns");
        for (Map.Entry<?, ?> entry : patternMap.entrySet()) {
            String profileId = asString(entry.getKey(), null);
            if (profileId == null || !(entry.getValue() instanceof List<?> rawPatterns)) {
                throw new ConfigurationException("detection patterns must be a list: " + entry.getKey());
            }
            Set<String> distinct = new LinkedHashSet<>();
            for (Object rawPattern : rawPatterns) {
                String regex = asString(rawPattern, null);
                if (regex != null) {
                    distinct.add(regex);
                }
            }
            List<Pattern> patterns = new ArrayList<>(distinct.size());
            for (String regex : distinct) {
                try {
                    patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
                } catch (PatternSyntaxException ex) {
                    throw new ConfigurationException("invalid detection pattern for " + profileId + ": " + regex, ex);
                }
            }
            compiled.put(profileId, patterns);
        }
        return compiled;
    }

    private RetrievalConfig.DetectionSettings parseDetection(Map<?, ?> map) {
        RetrievalConfig.DetectionSettings defaults = RetrievalConfig.DetectionSettings.defaults();
        return new RetrievalConfig.DetectionSettings(
            asBoolean(map, "enable", defaults.enabled()),
            asDouble(map, "confidence_threshold", defaults.confidenceThreshold())
        );
    }

    private RetrievalConfig.FilterSettings parseFilters(Map<?, ?> map) {
        RetrievalConfig.FilterSettings defaults = RetrievalConfig.FilterSettings.defaults();
        List<FilterMapping> mappings = new ArrayList<>();
        for (Map.Entry<?, ?> entry : section(map, "filter_mappings").entrySet()) {
            mappings.add(parseMapping(entry.getKey(), entry.getValue()));
        }
        return new RetrievalConfig.FilterSettings(
            asBoolean(map, "enable_parsing", defaults.enableParsing()),
            asDouble(map, "confidence_threshold", defaults.confidenceThreshold()),
            asDouble(map, "filter_strength", defaults.filterStrength()),
            asDouble(map, "high_threshold", defaults.highThreshold()),
            asDouble(map, "low_threshold", defaults.lowThreshold()),
            asDouble(map, "base_confidence", defaults.baseConfidence()),
            mappings
        );
    }

    private FilterMapping parseMapping(Object rawPhrase, Object rawValue) {
        String phrase = asString(rawPhrase, null);
        if (phrase == null || !(rawValue instanceof Map<?, ?> body)) {
            throw new ConfigurationException("invalid filter mapping: " + rawPhrase);
        }
        Double confidence = null;
        Map<?, ?> constraints = body;
        if (body.get("constraints") instanceof Map<?, ?> extended) {
            constraints = extended;
            if (body.containsKey("confidence")) {
                confidence = toDouble(body.get("confidence"));
                if (confidence == null) {
                    throw new ConfigurationException("invalid confidence for filter phrase: " + phrase);
                }
            }
        }
        List<DimensionTarget> targets = new ArrayList<>();
        for (Map.Entry<?, ?> constraint : constraints.entrySet()) {
            String dimension = asString(constraint.getKey(), null);
            if (dimension == null) {
                throw new ConfigurationException("filter phrase has blank dimension: " + phrase);
            }
            targets.add(parseTarget(phrase, dimension, constraint.getValue()));
        }
        if (targets.isEmpty()) {
            throw new ConfigurationException("filter phrase maps to no dimension: " + phrase);
        }
        return new FilterMapping(phrase, targets, confidence);
    }

    private DimensionTarget parseTarget(String phrase, String dimension, Object raw) {
        if (raw instanceof Number number) {
            return DimensionTarget.atLeast(dimension, number.doubleValue());
        }
        String text = asString(raw, null);
        TargetLevel level = TargetLevel.from(text);
        if (level != null) {
            return new DimensionTarget(dimension, level, null);
        }
        Double threshold = toDouble(text);
        if (threshold != null) {
            return DimensionTarget.atLeast(dimension, threshold);
        }
        throw new ConfigurationException("invalid target '" + raw + "' for " + dimension + " in phrase " + phrase);
    }

    private RetrievalConfig.AlignmentSettings parseAlignment(Map<?, ?> map) {
        RetrievalConfig.AlignmentSettings defaults = RetrievalConfig.AlignmentSettings.defaults();

        AlignmentMethod method = defaults.method();
        String rawMethod = asString(map.get("alignment_method"), null);
        if (rawMethod != null) {
            method = AlignmentMethod.from(rawMethod);
            if (method == null) {
                throw new ConfigurationException("unknown alignment_method: " + rawMethod);
            }
        }
        NormalizationMode normalization = defaults.normalization();
        String rawNormalization = asString(map.get("normalization"), null);
        if (rawNormalization != null) {
            normalization = NormalizationMode.from(rawNormalization);
            if (normalization == null) {
                throw new ConfigurationException("unknown normalization: " + rawNormalization);
            }
        }

        Map<?, ?> boostMap = section(map, "confidence_boost");
        RetrievalConfig.ConfidenceBoost boostDefaults = defaults.confidenceBoost();
        RetrievalConfig.ConfidenceBoost boost = new RetrievalConfig.ConfidenceBoost(
            asBoolean(boostMap, "enable", boostDefaults.enabled()),
            asDouble(boostMap, "max_boost", boostDefaults.maxBoost()),
            asDouble(boostMap, "threshold", boostDefaults.threshold())
        );

        Map<?, ?> bonusMap = section(map, "profile_bonus");
        RetrievalConfig.ProfileBonus bonusDefaults = defaults.profileBonus();
        RetrievalConfig.ProfileBonus bonus = new RetrievalConfig.ProfileBonus(
            asBoolean(bonusMap, "enable", bonusDefaults.enabled()),
            asDouble(bonusMap, "same_profile_bonus", bonusDefaults.sameProfileBonus()),
            asDouble(bonusMap, "cross_profile_penalty", bonusDefaults.crossProfilePenalty())
        );
        return new RetrievalConfig.AlignmentSettings(method, normalization, boost, bonus);
    }

    private RetrievalConfig.CacheSettings parseCaching(Map<?, ?> map) {
        RetrievalConfig.CacheSettings defaults = RetrievalConfig.CacheSettings.defaults();
        return new RetrievalConfig.CacheSettings(
            asBoolean(map, "enable_dimension_cache", defaults.enableDimensionCache()),
            asInt(map, "cache_size", defaults.cacheSize()),
            asLong(map, "cache_ttl", defaults.cacheTtlSeconds()),
            asBoolean(map, "enable_query_cache", defaults.enableQueryCache()),
            asInt(map, "query_cache_size", defaults.queryCacheSize())
        );
    }

    private RetrievalConfig.LoggingSettings parseLogging(Map<?, ?> map) {
        RetrievalConfig.LoggingSettings defaults = RetrievalConfig.LoggingSettings.defaults();
        return new RetrievalConfig.LoggingSettings(
            asBoolean(map, "log_scoring_details", defaults.logScoringDetails()),
            asBoolean(map, "log_performance", defaults.logPerformance()),
            asBoolean(map, "log_filters", defaults.logFilters())
        );
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }

    private Map<?, ?> section(Map<?, ?> parent, String key) {
        Object raw = parent == null ? null : parent.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConfigurationException("section '" + key + "' must be a map");
        }
        return map;
    }

    private RetrievalStrategy asStrategy(Map<?, ?> map, String key, RetrievalStrategy fallback) {
        String raw = asString(map.get(key), null);
        if (raw == null) {
            return fallback;
        }
        RetrievalStrategy strategy = RetrievalStrategy.from(raw);
        if (strategy == null) {
            throw new ConfigurationException("unknown strategy for " + key + ": " + raw);
        }
        return strategy;
    }

    private boolean asBoolean(Map<?, ?> map, String key, boolean fallback) {
        Object raw = map.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Boolean value) {
            return value;
        }
        String text = raw.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException("expected boolean for " + key + ": " + raw);
    }

    private int asInt(Map<?, ?> map, String key, int fallback) {
        Object raw = map.get(key);
        if (raw == null) {
            return fallback;
        }
        Double value = toDouble(raw);
        if (value == null || value != Math.rint(value)) {
            throw new ConfigurationException("expected integer for " + key + ": " + raw);
        }
        return value.intValue();
    }

    private long asLong(Map<?, ?> map, String key, long fallback) {
        Object raw = map.get(key);
        if (raw == null) {
            return fallback;
        }
        Double value = toDouble(raw);
        if (value == null || value != Math.rint(value)) {
            throw new ConfigurationException("expected integer for " + key + ": " + raw);
        }
        return value.longValue();
    }

    private double asDouble(Map<?, ?> map, String key, double fallback) {
        Object raw = map.get(key);
        if (raw == null) {
            return fallback;
        }
        Double value = toDouble(raw);
        if (value == null) {
            throw new ConfigurationException("expected number for " + key + ": " + raw);
        }
        return value;
    }

    private String asString(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? fallback : value;
    }

    private Double toDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
