package com.trendsentinel.core.trend;

import java.util.LinkedHashMap;
import java.util.List;

public class FrequencyAggregator {
    public FrequencyTable aggregate(List<String> tokens) {
        LinkedHashMap<String, Integer> counts = new LinkedHashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return new FrequencyTable(counts);
    }
}
