package com.trendsentinel.service.api;

import java.util.Arrays;

public enum Timeframe {
    TEN_MINUTES("10min", 0.17),
    ONE_HOUR("1hour", 1),
    SIX_HOURS("6hour", 6),
    DAY("24hour", 24);

    private final String pathName;
    private final double hours;

    Timeframe(String pathName, double hours) {
        this.pathName = pathName;
        this.hours = hours;
    }

    public String pathName() {
        return pathName;
    }

    public double hours() {
        return hours;
    }

    /**
     * Unknown or missing names resolve to {@link #ONE_HOUR}.
     */
    public static Timeframe fromPathName(String name) {
        return Arrays.stream(values())
                .filter(timeframe -> timeframe.pathName.equals(name))
                .findFirst()
                .orElse(ONE_HOUR);
    }
}
