package com.bsl.dimrank.filter;

import java.util.List;

/**
 * A configured phrase and the dimension targets it implies. {@code confidence} is null when
 * the phrase uses the global base confidence.
 */
public record FilterMapping(String phrase, List<DimensionTarget> targets, Double confidence) {
    public FilterMapping {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
