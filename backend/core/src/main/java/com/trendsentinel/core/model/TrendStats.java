package com.trendsentinel.core.model;

public record TrendStats(
        long totalRecords,
        long uniqueTokens,
        long alertsCount
) {
}
