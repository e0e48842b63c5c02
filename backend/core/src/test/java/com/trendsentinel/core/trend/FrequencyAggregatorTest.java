package com.trendsentinel.core.trend;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrequencyAggregatorTest {
    private final FrequencyAggregator aggregator = new FrequencyAggregator();

    @Test
    void countsSumToNumberOfTokens() {
        List<String> tokens = List.of("alpha", "beta", "alpha", "#gamma", "beta", "alpha");

        FrequencyTable table = aggregator.aggregate(tokens);

        assertEquals(tokens.size(), table.total());
        assertEquals(3, table.distinctTokens());
        assertEquals(3, table.countOf("alpha"));
        assertEquals(0, table.countOf("missing"));
    }

    @Test
    void rankingBreaksTiesByFirstOccurrence() {
        FrequencyTable table = aggregator.aggregate(List.of("zeta", "alpha", "mid", "alpha", "zeta", "omega", "mid"));

        assertEquals(
                List.of(new TokenCount("zeta", 2), new TokenCount("alpha", 2), new TokenCount("mid", 2), new TokenCount("omega", 1)),
                table.ranked()
        );
    }

    @Test
    void topLimitsRankedTokens() {
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            for (int repeat = 0; repeat <= i % 5; repeat++) {
                tokens.add("token" + (char) ('a' + i % 26) + i);
            }
        }
        FrequencyTable table = aggregator.aggregate(tokens);

        List<TokenCount> top = table.top(30);
        assertEquals(30, top.size());
        assertEquals(table.ranked().subList(0, 30), top);
        for (int i = 1; i < top.size(); i++) {
            assertTrue(top.get(i - 1).count() >= top.get(i).count());
        }
    }

    @Test
    void emptyInputGivesEmptyTable() {
        FrequencyTable table = aggregator.aggregate(List.of());

        assertTrue(table.isEmpty());
        assertEquals(0, table.total());
        assertEquals(List.of(), table.top(30));
    }
}
