package com.trendsentinel.service.config;

import com.trendsentinel.collectors.cycle.CycleSettings;
import com.trendsentinel.collectors.reddit.RedditSourceConfig;
import com.trendsentinel.core.trend.TrendState;
import com.trendsentinel.core.trend.TrendThresholds;

import java.time.Duration;
import java.util.List;

/**
 * Contents of {@code monitor.json}. Every field is optional; missing values fall back to the
 * defaults below.
 */
public record MonitorConfig(
        List<String> sources,
        Duration fetchDelay,
        Duration cycleInterval,
        Duration errorBackoff,
        RedditConfig reddit,
        ThresholdConfig thresholds,
        List<String> extraStopwords,
        String dataDir,
        Integer apiPort
) {
    public static final Duration DEFAULT_CYCLE_INTERVAL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofMinutes(1);
    public static final String DEFAULT_DATA_DIR = "data";
    public static final int DEFAULT_API_PORT = 8080;

    public MonitorConfig {
        sources = sources == null || sources.isEmpty() ? CycleSettings.DEFAULT_SOURCE_IDS : List.copyOf(sources);
        fetchDelay = fetchDelay == null ? CycleSettings.DEFAULT_FETCH_DELAY : fetchDelay;
        cycleInterval = cycleInterval == null ? DEFAULT_CYCLE_INTERVAL : cycleInterval;
        errorBackoff = errorBackoff == null ? DEFAULT_ERROR_BACKOFF : errorBackoff;
        reddit = reddit == null ? new RedditConfig(null, null, null, null) : reddit;
        thresholds = thresholds == null ? new ThresholdConfig(null, null, null, null, null) : thresholds;
        extraStopwords = extraStopwords == null ? List.of() : List.copyOf(extraStopwords);
        dataDir = dataDir == null || dataDir.isBlank() ? DEFAULT_DATA_DIR : dataDir;
        apiPort = apiPort == null ? DEFAULT_API_PORT : apiPort;
        if (cycleInterval.isNegative() || cycleInterval.isZero() || errorBackoff.isNegative() || errorBackoff.isZero()) {
            throw new IllegalArgumentException("cycleInterval and errorBackoff must be positive");
        }
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null, null, null);
    }

    public CycleSettings cycleSettings() {
        return new CycleSettings(sources, fetchDelay);
    }

    public RedditSourceConfig redditSourceConfig() {
        RedditSourceConfig defaults = RedditSourceConfig.defaults();
        return new RedditSourceConfig(
                reddit.baseUrl() == null ? defaults.baseUrl() : reddit.baseUrl(),
                reddit.limit() == null ? defaults.limit() : reddit.limit(),
                reddit.userAgent() == null ? defaults.userAgent() : reddit.userAgent(),
                reddit.requestTimeout() == null ? defaults.requestTimeout() : reddit.requestTimeout()
        );
    }

    public TrendThresholds trendThresholds() {
        return new TrendThresholds(
                thresholds.minCount() == null ? TrendThresholds.DEFAULT_MIN_COUNT : thresholds.minCount(),
                thresholds.newTokenMinCount() == null ? TrendThresholds.DEFAULT_NEW_TOKEN_MIN_COUNT : thresholds.newTokenMinCount(),
                thresholds.spikePercent() == null ? TrendThresholds.DEFAULT_SPIKE_PERCENT : thresholds.spikePercent(),
                thresholds.classifyTop() == null ? TrendThresholds.DEFAULT_CLASSIFY_TOP : thresholds.classifyTop(),
                thresholds.retainedTop() == null ? TrendState.MAX_ENTRIES : thresholds.retainedTop()
        );
    }

    public record RedditConfig(String baseUrl, Integer limit, String userAgent, Duration requestTimeout) {
    }

    public record ThresholdConfig(
            Integer minCount,
            Integer newTokenMinCount,
            Double spikePercent,
            Integer classifyTop,
            Integer retainedTop
    ) {
    }
}
