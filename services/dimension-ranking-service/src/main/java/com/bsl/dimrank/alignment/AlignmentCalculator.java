package com.bsl.dimrank.alignment;

import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterConstraint;
import com.bsl.dimrank.profile.Profile;
import com.bsl.dimrank.store.DimensionScore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes how well a chunk's dimension scores match the active profile and the query's
 * filter constraints. The returned value is always within [0,1].
 */
public final class AlignmentCalculator {
    private AlignmentCalculator() {
    }

    public static AlignmentResult calculate(
        Map<String, DimensionScore> dimensionScores,
        Profile activeProfile,
        List<FilterConstraint> constraints,
        Profile chunkProfile,
        RetrievalConfig.AlignmentSettings alignment,
        RetrievalConfig.FilterSettings filters
    ) {
        Map<String, DimensionScore> scores = dimensionScores == null ? Map.of() : dimensionScores;
        Map<String, List<DimensionTarget>> targetsByDimension = groupTargets(constraints);

        Set<String> dimensions = new LinkedHashSet<>(activeProfile.getDimensions().keySet());
        dimensions.addAll(targetsByDimension.keySet());

        Map<String, Double> contributions = new LinkedHashMap<>();
        Map<String, Double> multipliers = new LinkedHashMap<>();
        int penalized = 0;
        for (String dimension : dimensions) {
            DimensionScore score = scores.get(dimension);
            if (score == null || Double.isNaN(score.value())) {
                continue;
            }
            double multiplier = activeProfile.multiplier(dimension);
            double contribution = score.value() * multiplier;
            for (DimensionTarget target : targetsByDimension.getOrDefault(dimension, List.of())) {
                if (!target.isSatisfiedBy(score.value(), filters.highThreshold(), filters.lowThreshold())) {
                    contribution *= 1.0 - filters.filterStrength();
                    penalized++;
                }
            }
            contributions.put(dimension, contribution);
            multipliers.put(dimension, multiplier);
        }

        double aggregate = aggregate(contributions, multipliers, alignment);
        double normalized = clamp01(normalize(aggregate, multipliers, alignment));
        double boost = confidenceBoost(scores, alignment.confidenceBoost());
        double boosted = Math.min(1.0, normalized + boost);
        double bonus = profileBonus(activeProfile, chunkProfile, alignment.profileBonus());
        double value = clamp01(boosted + bonus);

        return new AlignmentResult(value, aggregate, normalized, boost, bonus, contributions.size(), penalized);
    }

    private static Map<String, List<DimensionTarget>> groupTargets(List<FilterConstraint> constraints) {
        Map<String, List<DimensionTarget>> grouped = new LinkedHashMap<>();
        if (constraints == null) {
            return grouped;
        }
        Set<DimensionTarget> seen = new LinkedHashSet<>();
        for (FilterConstraint constraint : constraints) {
            for (DimensionTarget target : constraint.targets()) {
                // two phrases asking for the same target count once
                if (seen.add(target)) {
                    grouped.computeIfAbsent(target.dimension(), key -> new ArrayList<>()).add(target);
                }
            }
        }
        return grouped;
    }

    static double aggregate(
        Map<String, Double> contributions,
        Map<String, Double> multipliers,
        RetrievalConfig.AlignmentSettings alignment
    ) {
        if (contributions.isEmpty()) {
            return 0.0;
        }
        return switch (alignment.method()) {
            case MIN -> contributions.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            case MAX -> contributions.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case AVERAGE -> contributions.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case WEIGHTED_AVERAGE -> {
                double weighted = 0.0;
                double totalWeight = 0.0;
                for (Map.Entry<String, Double> entry : contributions.entrySet()) {
                    double weight = multipliers.get(entry.getKey());
                    weighted += entry.getValue() * weight;
                    totalWeight += weight;
                }
                yield totalWeight <= 0.0 ? 0.0 : weighted / totalWeight;
            }
        };
    }

    static double normalize(double aggregate, Map<String, Double> multipliers, RetrievalConfig.AlignmentSettings alignment) {
        if (multipliers.isEmpty()) {
            return 0.0;
        }
        return switch (alignment.normalization()) {
            case NONE -> aggregate;
            case TOTAL_WEIGHT -> {
                double total = multipliers.values().stream().mapToDouble(Double::doubleValue).sum();
                yield total <= 0.0 ? 0.0 : aggregate / total;
            }
            case MAX_WEIGHT -> {
                double max = multipliers.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
                yield max <= 0.0 ? 0.0 : aggregate / max;
            }
        };
    }

    static double confidenceBoost(Map<String, DimensionScore> scores, RetrievalConfig.ConfidenceBoost settings) {
        if (settings == null || !settings.enabled() || settings.maxBoost() <= 0.0) {
            return 0.0;
        }
        double sum = 0.0;
        int count = 0;
        for (DimensionScore score : scores.values()) {
            if (score.confidence() == null || score.confidence().isNaN()) {
                continue;
            }
            sum += clamp01(score.confidence());
            count++;
        }
        if (count == 0) {
            return 0.0;
        }
        double average = sum / count;
        if (average < settings.threshold()) {
            return 0.0;
        }
        double headroom = 1.0 - settings.threshold();
        if (headroom <= 0.0) {
            return settings.maxBoost();
        }
        return settings.maxBoost() * Math.min(1.0, (average - settings.threshold()) / headroom);
    }

    static double profileBonus(Profile activeProfile, Profile chunkProfile, RetrievalConfig.ProfileBonus settings) {
        if (settings == null || !settings.enabled()) {
            return 0.0;
        }
        if (chunkProfile != null && chunkProfile.getId().equals(activeProfile.getId())) {
            return settings.sameProfileBonus();
        }
        return -settings.crossProfilePenalty();
    }

    static double clamp01(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
