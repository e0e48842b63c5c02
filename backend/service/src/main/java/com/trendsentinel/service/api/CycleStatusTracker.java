package com.trendsentinel.service.api;

import com.trendsentinel.collectors.cycle.CycleStatus;
import com.trendsentinel.core.bus.EventBus;
import com.trendsentinel.core.events.CycleCompleted;
import com.trendsentinel.core.events.CycleStarted;
import com.trendsentinel.core.events.SourceFetchFailed;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Keeps the latest cycle lifecycle events for the status endpoint. Updated from the cycle
 * thread, read from HTTP worker threads.
 */
public final class CycleStatusTracker {
    private Instant lastStartedAt;
    private CycleCompleted lastCompleted;
    private SourceFetchFailed lastFetchFailure;
    private long cyclesFinished;
    private long cyclesCompleted;
    private long fetchFailures;

    public CycleStatusTracker(EventBus eventBus) {
        eventBus.subscribe(CycleStarted.class, this::onStarted);
        eventBus.subscribe(CycleCompleted.class, this::onCompleted);
        eventBus.subscribe(SourceFetchFailed.class, this::onFetchFailed);
    }

    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> status = new HashMap<>();
        status.put("cyclesFinished", cyclesFinished);
        status.put("cyclesCompleted", cyclesCompleted);
        status.put("fetchFailures", fetchFailures);
        status.put("lastStartedAt", lastStartedAt == null ? null : lastStartedAt.toString());
        if (lastCompleted != null) {
            status.put("lastCycleNumber", lastCompleted.cycleNumber());
            status.put("lastStatus", lastCompleted.status());
            status.put("lastCompletedAt", lastCompleted.timestamp().toString());
            status.put("lastDurationMillis", lastCompleted.durationMillis());
            status.put("lastTokens", lastCompleted.tokens());
            status.put("lastAlerts", lastCompleted.alerts());
        }
        if (lastFetchFailure != null) {
            status.put("lastFetchFailure", Map.of(
                    "sourceId", lastFetchFailure.sourceId(),
                    "message", String.valueOf(lastFetchFailure.message()),
                    "at", lastFetchFailure.timestamp().toString()
            ));
        }
        return status;
    }

    private synchronized void onStarted(CycleStarted event) {
        lastStartedAt = event.timestamp();
    }

    private synchronized void onCompleted(CycleCompleted event) {
        lastCompleted = event;
        cyclesFinished++;
        if (CycleStatus.COMPLETED.name().equals(event.status())) {
            cyclesCompleted++;
        }
    }

    private synchronized void onFetchFailed(SourceFetchFailed event) {
        lastFetchFailure = event;
        fetchFailures++;
    }
}
