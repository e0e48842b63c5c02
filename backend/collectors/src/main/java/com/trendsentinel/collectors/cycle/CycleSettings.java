package com.trendsentinel.collectors.cycle;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record CycleSettings(List<String> sourceIds, Duration fetchDelay) {
    public static final List<String> DEFAULT_SOURCE_IDS = List.of("all", "popular");
    public static final Duration DEFAULT_FETCH_DELAY = Duration.ofSeconds(1);

    public CycleSettings {
        Objects.requireNonNull(sourceIds, "sourceIds is required");
        Objects.requireNonNull(fetchDelay, "fetchDelay is required");
        if (sourceIds.isEmpty()) {
            throw new IllegalArgumentException("at least one source id is required");
        }
        if (fetchDelay.isNegative()) {
            throw new IllegalArgumentException("fetchDelay must not be negative");
        }
        sourceIds = List.copyOf(sourceIds);
    }

    public static CycleSettings defaults() {
        return new CycleSettings(DEFAULT_SOURCE_IDS, DEFAULT_FETCH_DELAY);
    }
}
