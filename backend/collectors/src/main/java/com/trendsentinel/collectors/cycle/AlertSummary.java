package com.trendsentinel.collectors.cycle;

import com.trendsentinel.core.model.AlertKind;
import com.trendsentinel.core.model.TrendAlert;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable lines for the alerts of one cycle.
 */
public final class AlertSummary {
    public static final int DEFAULT_LIMIT = 10;
    static final String NO_TRENDS = "No significant trends detected";

    private AlertSummary() {
    }

    public static List<String> lines(List<TrendAlert> alerts, int limit) {
        if (alerts.isEmpty()) {
            return List.of(NO_TRENDS);
        }
        List<String> lines = new ArrayList<>();
        lines.add("Trending tokens:");
        for (TrendAlert alert : alerts.subList(0, Math.min(limit, alerts.size()))) {
            lines.add(describe(alert));
        }
        return lines;
    }

    static String describe(TrendAlert alert) {
        if (alert.kind() == AlertKind.NEW) {
            return String.format(Locale.ROOT, "[new] %s - %d mentions (NEW)", alert.token(), alert.count());
        }
        return String.format(Locale.ROOT, "[spike] %s - %d mentions (+%.0f%%)", alert.token(), alert.count(), alert.changePercent());
    }
}
