package com.trendsentinel.core.trend;

import com.trendsentinel.core.model.TrendAlert;

import java.util.List;

/**
 * Result of classifying one cycle. {@code stagedState} only becomes the baseline once the
 * classification is committed; {@code baseline} is the state it was computed against.
 */
public record Classification(List<TrendAlert> alerts, TrendState stagedState, TrendState baseline) {
    public Classification {
        alerts = List.copyOf(alerts);
    }
}
