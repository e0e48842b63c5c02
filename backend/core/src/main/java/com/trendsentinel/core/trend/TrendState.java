package com.trendsentinel.core.trend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the previous cycle's highest token counts, used as the classification baseline.
 */
public final class TrendState {
    public static final int MAX_ENTRIES = 100;

    private static final TrendState EMPTY = new TrendState(new LinkedHashMap<>());

    private final Map<String, Integer> counts;

    private TrendState(LinkedHashMap<String, Integer> counts) {
        if (counts.size() > MAX_ENTRIES) {
            throw new IllegalArgumentException("Trend state holds at most " + MAX_ENTRIES + " entries, got " + counts.size());
        }
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static TrendState empty() {
        return EMPTY;
    }

    public static TrendState of(Map<String, Integer> counts) {
        return new TrendState(new LinkedHashMap<>(counts));
    }

    static TrendState topOf(FrequencyTable table, int limit) {
        LinkedHashMap<String, Integer> retained = new LinkedHashMap<>();
        for (TokenCount entry : table.top(limit)) {
            retained.put(entry.token(), entry.count());
        }
        return new TrendState(retained);
    }

    public int countOf(String token) {
        return counts.getOrDefault(token, 0);
    }

    public int size() {
        return counts.size();
    }

    public Map<String, Integer> asMap() {
        return counts;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TrendState state && counts.equals(state.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "TrendState" + counts;
    }
}
