package com.trendsentinel.collectors.api;

/**
 * A source could not be read: network error, timeout, non-success status or malformed payload.
 */
public class FetchException extends Exception {
    private final String sourceId;

    public FetchException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public FetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
