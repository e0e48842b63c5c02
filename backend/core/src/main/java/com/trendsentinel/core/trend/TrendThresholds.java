package com.trendsentinel.core.trend;

public record TrendThresholds(
        int minCount,
        int newTokenMinCount,
        double spikePercent,
        int classifyTop,
        int retainedTop
) {
    public static final int DEFAULT_MIN_COUNT = 2;
    public static final int DEFAULT_NEW_TOKEN_MIN_COUNT = 3;
    public static final double DEFAULT_SPIKE_PERCENT = 50.0;
    public static final int DEFAULT_CLASSIFY_TOP = 30;

    public TrendThresholds {
        if (minCount < 1 || newTokenMinCount < 1) {
            throw new IllegalArgumentException("minimum counts must be positive");
        }
        if (spikePercent <= 0) {
            throw new IllegalArgumentException("spikePercent must be positive");
        }
        if (classifyTop < 1) {
            throw new IllegalArgumentException("classifyTop must be positive");
        }
        if (retainedTop < 1 || retainedTop > TrendState.MAX_ENTRIES) {
            throw new IllegalArgumentException("retainedTop must be between 1 and " + TrendState.MAX_ENTRIES);
        }
    }

    public static TrendThresholds defaults() {
        return new TrendThresholds(
                DEFAULT_MIN_COUNT,
                DEFAULT_NEW_TOKEN_MIN_COUNT,
                DEFAULT_SPIKE_PERCENT,
                DEFAULT_CLASSIFY_TOP,
                TrendState.MAX_ENTRIES
        );
    }
}
