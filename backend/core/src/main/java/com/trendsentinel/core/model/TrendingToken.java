package com.trendsentinel.core.model;

public record TrendingToken(
        String token,
        long totalCount,
        String source
) {
}
