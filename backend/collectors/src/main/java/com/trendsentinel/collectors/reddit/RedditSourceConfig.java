package com.trendsentinel.collectors.reddit;

import java.time.Duration;
import java.util.Objects;

public record RedditSourceConfig(
        String baseUrl,
        int limit,
        String userAgent,
        Duration requestTimeout
) {
    public static final String DEFAULT_BASE_URL = "https://www.reddit.com";
    public static final String DEFAULT_USER_AGENT = "TrendSentinel/1.0 (trend monitor)";

    public RedditSourceConfig {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        Objects.requireNonNull(userAgent, "userAgent is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static RedditSourceConfig defaults() {
        return new RedditSourceConfig(DEFAULT_BASE_URL, 25, DEFAULT_USER_AGENT, Duration.ofSeconds(10));
    }
}
