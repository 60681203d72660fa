package com.bsl.dimrank.profile;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies query text into a profile. A profile's confidence is the fraction of its
 * distinct patterns that match, so profiles with many overlapping patterns gain nothing
 * from repetition.
 */
public final class ProfileDetector {
    private ProfileDetector() {
    }

    public static ProfileMatch detect(String queryText, ProfileRegistry registry, boolean enabled, double threshold) {
        Profile fallback = registry.defaultProfile();
        if (!enabled || queryText == null || queryText.isBlank()) {
            return new ProfileMatch(fallback, 0.0, false);
        }
        Profile best = null;
        double bestConfidence = 0.0;
        for (Profile profile : registry.profiles()) {
            double confidence = confidence(queryText, profile.getDetectionPatterns());
            if (confidence <= 0.0 || confidence < threshold) {
                continue;
            }
            // first-declared profile wins ties
            if (best == null || confidence > bestConfidence) {
                best = profile;
                bestConfidence = confidence;
            }
        }
        if (best == null) {
            return new ProfileMatch(fallback, 0.0, false);
        }
        return new ProfileMatch(best, bestConfidence, true);
    }

    static double confidence(String queryText, List<Pattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return 0.0;
        }
        int matched = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(queryText).find()) {
                matched++;
            }
        }
        return (double) matched / patterns.size();
    }
}
