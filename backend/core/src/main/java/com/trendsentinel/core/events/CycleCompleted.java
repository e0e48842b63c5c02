package com.trendsentinel.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycleNumber,
        String status,
        int tokens,
        int alerts,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
