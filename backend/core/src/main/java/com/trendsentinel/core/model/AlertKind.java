package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertKind {
    NEW,
    SPIKE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
