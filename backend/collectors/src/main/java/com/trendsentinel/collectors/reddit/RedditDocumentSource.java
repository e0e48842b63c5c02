package com.trendsentinel.collectors.reddit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.trendsentinel.collectors.api.DocumentSource;
import com.trendsentinel.collectors.api.FetchException;
import com.trendsentinel.core.model.RawDocument;
import com.trendsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the "hot" listing of a subreddit through the public JSON endpoint. The source id is
 * the subreddit name.
 */
public class RedditDocumentSource implements DocumentSource {
    private final HttpClient httpClient;
    private final RedditSourceConfig config;

    public RedditDocumentSource(HttpClient httpClient, RedditSourceConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public String name() {
        return "reddit";
    }

    @Override
    public List<RawDocument> fetch(String sourceId) throws FetchException {
        URI uri = listingUri(sourceId);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", config.userAgent())
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException(sourceId, "Timed out fetching " + uri, e);
        } catch (IOException e) {
            throw new FetchException(sourceId, "Failed fetching " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(sourceId, "Interrupted fetching " + uri, e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new FetchException(sourceId, "Listing request failed with status " + response.statusCode() + " for " + uri);
        }
        return parseListing(response.body(), sourceId);
    }

    URI listingUri(String sourceId) {
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        return URI.create(base + "/r/" + URLEncoder.encode(sourceId, StandardCharsets.UTF_8)
                + "/hot.json?limit=" + config.limit());
    }

    static List<RawDocument> parseListing(String body, String sourceId) throws FetchException {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(sourceId, "Malformed listing JSON for " + sourceId, e);
        }
        JsonNode children = root == null ? null : root.path("data").path("children");
        if (children == null || !children.isArray()) {
            throw new FetchException(sourceId, "Listing for " + sourceId + " has no data.children array");
        }
        List<RawDocument> documents = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            JsonNode post = child.path("data");
            documents.add(new RawDocument(post.path("title").asText(""), post.path("selftext").asText("")));
        }
        return documents;
    }
}
