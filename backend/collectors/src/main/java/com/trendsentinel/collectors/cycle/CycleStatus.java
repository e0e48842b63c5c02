package com.trendsentinel.collectors.cycle;

public enum CycleStatus {
    COMPLETED,
    SKIPPED_ALL_SOURCES_FAILED,
    SKIPPED_NO_TOKENS,
    PERSISTENCE_FAILED;

    public boolean committed() {
        return this == COMPLETED;
    }
}
