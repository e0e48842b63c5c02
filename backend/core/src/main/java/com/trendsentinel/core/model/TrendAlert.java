package com.trendsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A token that crossed the new-or-spike threshold in one cycle.
 * {@code changePercent} is always 0 for {@link AlertKind#NEW}.
 */
public record TrendAlert(
        String token,
        int count,
        double changePercent,
        AlertKind kind,
        Instant timestamp
) {
    public TrendAlert {
        Objects.requireNonNull(token, "token is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static TrendAlert newToken(String token, int count, Instant timestamp) {
        return new TrendAlert(token, count, 0.0, AlertKind.NEW, timestamp);
    }

    public static TrendAlert spike(String token, int count, double changePercent, Instant timestamp) {
        return new TrendAlert(token, count, changePercent, AlertKind.SPIKE, timestamp);
    }
}
