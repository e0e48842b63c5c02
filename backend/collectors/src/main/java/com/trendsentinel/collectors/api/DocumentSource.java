package com.trendsentinel.collectors.api;

import com.trendsentinel.core.model.RawDocument;

import java.util.List;

/**
 * Supplies the raw documents currently visible under one source identifier.
 */
public interface DocumentSource {
    String name();

    List<RawDocument> fetch(String sourceId) throws FetchException;
}
