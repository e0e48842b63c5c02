package com.trendsentinel.core.events;

import java.time.Instant;
import java.util.List;

public record CycleStarted(Instant timestamp, long cycleNumber, List<String> sources) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
