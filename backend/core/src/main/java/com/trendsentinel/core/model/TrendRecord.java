package com.trendsentinel.core.model;

import java.time.Instant;

public record TrendRecord(
        String token,
        int count,
        String source,
        Instant timestamp
) {
}
