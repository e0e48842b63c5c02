package com.trendsentinel.collectors.api;

import com.trendsentinel.core.model.TrendAlert;
import com.trendsentinel.core.model.TrendRecord;

import java.util.List;

public interface TrendStore {
    void appendTrendRecords(List<TrendRecord> records) throws PersistenceException;

    void appendAlerts(List<TrendAlert> alerts) throws PersistenceException;

    /**
     * Persists one cycle's records and alerts together. On failure neither batch remains
     * visible to readers.
     */
    void appendCycle(List<TrendRecord> records, List<TrendAlert> alerts) throws PersistenceException;
}
