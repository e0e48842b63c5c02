package com.trendsentinel.core.model;

public record RawDocument(String title, String body) {
    public RawDocument {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
    }

    public String text() {
        return title + " " + body;
    }
}
