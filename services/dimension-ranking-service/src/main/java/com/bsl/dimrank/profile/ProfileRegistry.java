package com.bsl.dimrank.profile;

import com.bsl.dimrank.store.DimensionScore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of scoring profiles. Declaration order is kept because it decides
 * ties in profile detection and in {@link #bestMatchingProfile(Map)}.
 */
public final class ProfileRegistry {
    public static final String DEFAULT_PROFILE_ID = "general";

    private final List<Profile> profiles;
    private final Map<String, Profile> byId;

    public ProfileRegistry(List<Profile> profiles) {
        this.profiles = profiles == null ? List.of() : List.copyOf(profiles);
        Map<String, Profile> map = new LinkedHashMap<>();
        for (Profile profile : this.profiles) {
            map.put(profile.getId(), profile);
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public Optional<Profile> get(String profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(profileId.trim()));
    }

    public Profile defaultProfile() {
        Profile profile = byId.get(DEFAULT_PROFILE_ID);
        if (profile == null) {
            throw new IllegalStateException("default profile missing: " + DEFAULT_PROFILE_ID);
        }
        return profile;
    }

    public List<Profile> profiles() {
        return profiles;
    }

    public int size() {
        return profiles.size();
    }

    /**
     * Returns the profile whose multiplier-weighted mean over its own dimensions present in
     * the chunk is highest, or empty when the chunk scores none of them.
     */
    public Optional<Profile> bestMatchingProfile(Map<String, DimensionScore> dimensionScores) {
        if (dimensionScores == null || dimensionScores.isEmpty()) {
            return Optional.empty();
        }
        Profile best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Profile profile : profiles) {
            double sum = 0.0;
            int matched = 0;
            for (Map.Entry<String, Double> dimension : profile.getDimensions().entrySet()) {
                DimensionScore score = dimensionScores.get(dimension.getKey());
                if (score == null) {
                    continue;
                }
                sum += score.value() * dimension.getValue();
                matched++;
            }
            if (matched == 0) {
                continue;
            }
            double mean = sum / matched;
            // strict comparison keeps the first-declared profile on ties
            if (mean > bestScore) {
                bestScore = mean;
                best = profile;
            }
        }
        return Optional.ofNullable(best);
    }
}
