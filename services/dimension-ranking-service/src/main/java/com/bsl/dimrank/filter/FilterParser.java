package com.bsl.dimrank.filter;

import com.bsl.dimrank.config.RetrievalConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns free-text filter phrases into dimension constraints. Matching is case-insensitive
 * substring matching over the configured phrases; every phrase that matches contributes its
 * own constraint, so overlapping phrases are unioned rather than overridden.
 */
public final class FilterParser {
    private FilterParser() {
    }

    public static List<FilterConstraint> parse(String queryText, RetrievalConfig.FilterSettings settings) {
        if (settings == null || !settings.enableParsing() || queryText == null || queryText.isBlank()) {
            return List.of();
        }
        String lowered = queryText.toLowerCase(Locale.ROOT);
        List<FilterConstraint> constraints = new ArrayList<>();
        for (FilterMapping mapping : settings.mappings()) {
            String phrase = mapping.phrase().toLowerCase(Locale.ROOT);
            if (phrase.isEmpty() || !lowered.contains(phrase)) {
                continue;
            }
            double confidence = mapping.confidence() == null ? settings.baseConfidence() : mapping.confidence();
            if (confidence < settings.confidenceThreshold()) {
                continue;
            }
            constraints.add(new FilterConstraint(mapping.phrase(), mapping.targets(), confidence));
        }
        return constraints;
    }
}
