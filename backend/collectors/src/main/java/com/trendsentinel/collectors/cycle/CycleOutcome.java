package com.trendsentinel.collectors.cycle;

import com.trendsentinel.core.model.TrendAlert;

import java.time.Instant;
import java.util.List;

public record CycleOutcome(
        long cycleNumber,
        CycleStatus status,
        Instant timestamp,
        int documents,
        int tokens,
        int distinctTokens,
        List<TrendAlert> alerts,
        List<String> failedSources
) {
    public CycleOutcome {
        alerts = List.copyOf(alerts);
        failedSources = List.copyOf(failedSources);
    }

    static CycleOutcome skipped(long cycleNumber, CycleStatus status, Instant timestamp, int documents, List<String> failedSources) {
        return new CycleOutcome(cycleNumber, status, timestamp, documents, 0, 0, List.of(), failedSources);
    }
}
