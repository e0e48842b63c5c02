package com.trendsentinel.service.store;

import com.trendsentinel.core.model.TrendStats;
import com.trendsentinel.core.model.TrendingToken;

import java.util.List;

/**
 * Read side of the trend store used by the HTTP API.
 */
public interface TrendQueries {
    int RECENT_TRENDS_LIMIT = 20;

    /**
     * Tokens seen within the last {@code windowHours}, summed per token and source, highest
     * totals first, at most {@value #RECENT_TRENDS_LIMIT} entries.
     */
    List<TrendingToken> queryRecentTrends(double windowHours);

    TrendStats queryStats24h();
}
