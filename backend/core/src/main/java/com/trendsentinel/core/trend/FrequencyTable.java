package com.trendsentinel.core.trend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token counts for one cycle. Iteration and tie-breaking follow the order in which tokens
 * were first seen.
 */
public final class FrequencyTable {
    private static final Comparator<TokenCount> BY_COUNT_DESC =
            Comparator.comparingInt(TokenCount::count).reversed();

    private final Map<String, Integer> counts;
    private final int total;

    FrequencyTable(LinkedHashMap<String, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
        int sum = 0;
        for (int count : counts.values()) {
            sum += count;
        }
        this.total = sum;
    }

    public static FrequencyTable empty() {
        return new FrequencyTable(new LinkedHashMap<>());
    }

    public int countOf(String token) {
        return counts.getOrDefault(token, 0);
    }

    public int total() {
        return total;
    }

    public int distinctTokens() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Map<String, Integer> asMap() {
        return counts;
    }

    /**
     * All tokens by descending count; equal counts keep first-occurrence order.
     */
    public List<TokenCount> ranked() {
        List<TokenCount> ranked = new ArrayList<>(counts.size());
        counts.forEach((token, count) -> ranked.add(new TokenCount(token, count)));
        // List.sort is a stable merge sort
        ranked.sort(BY_COUNT_DESC);
        return ranked;
    }

    public List<TokenCount> top(int limit) {
        List<TokenCount> ranked = ranked();
        return ranked.size() <= limit ? ranked : List.copyOf(ranked.subList(0, limit));
    }
}
