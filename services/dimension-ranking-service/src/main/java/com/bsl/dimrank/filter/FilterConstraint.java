package com.bsl.dimrank.filter;

import java.util.List;

public record FilterConstraint(String phrase, List<DimensionTarget> targets, double confidence) {
    public FilterConstraint {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
