package com.trendsentinel.core.events;

import java.time.Instant;

public record SourceFetchFailed(Instant timestamp, String sourceId, String message) implements Event {
    @Override
    public String type() {
        return "SourceFetchFailed";
    }
}
