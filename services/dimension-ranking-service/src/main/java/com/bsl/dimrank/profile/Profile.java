package com.bsl.dimrank.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A named scoring profile: factor weights, per-dimension multipliers and the
 * precompiled patterns used to auto-detect it from query text.
 */
public final class Profile {
    public static final double DEFAULT_MULTIPLIER = 1.0;

    private final String id;
    private final String description;
    private final List<String> targetUsers;
    private final ProfileWeights weights;
    private final Map<String, Double> dimensions;
    private final List<Pattern> detectionPatterns;

    public Profile(
        String id,
        String description,
        List<String> targetUsers,
        ProfileWeights weights,
        Map<String, Double> dimensions,
        List<Pattern> detectionPatterns
    ) {
        this.id = id;
        this.description = description;
        this.targetUsers = targetUsers == null ? List.of() : List.copyOf(targetUsers);
        this.weights = weights;
        this.dimensions = dimensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        this.detectionPatterns = detectionPatterns == null ? List.of() : List.copyOf(detectionPatterns);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTargetUsers() {
        return targetUsers;
    }

    public ProfileWeights getWeights() {
        return weights;
    }

    public Map<String, Double> getDimensions() {
        return dimensions;
    }

    public double multiplier(String dimension) {
        Double value = dimensions.get(dimension);
        return value == null ? DEFAULT_MULTIPLIER : value;
    }

    public List<Pattern> getDetectionPatterns() {
        return detectionPatterns;
    }
}
