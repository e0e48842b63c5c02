package com.trendsentinel.service.api;

import com.trendsentinel.core.model.TrendStats;
import com.trendsentinel.core.model.TrendingToken;
import com.trendsentinel.core.util.JsonUtils;
import com.trendsentinel.service.store.TrendQueries;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON API over the persisted trend data.
 */
public class ApiServer {
    public static final int HOT_THRESHOLD = 10;

    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String TRENDS_PREFIX = "/api/trends/";

    private final int port;
    private final TrendQueries queries;
    private final CycleStatusTracker statusTracker;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, TrendQueries queries, CycleStatusTracker statusTracker, Clock clock) {
        this.port = port;
        this.queries = queries;
        this.statusTracker = statusTracker;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext(TRENDS_PREFIX, this::handleTrends);
            server.createContext("/api/stats", this::handleStats);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/cycles/status", this::handleCycleStatus);
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleTrends(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        Timeframe timeframe = Timeframe.fromPathName(path.substring(TRENDS_PREFIX.length()));
        respond(exchange, () -> {
            List<Map<String, Object>> items = new ArrayList<>();
            for (TrendingToken trend : queries.queryRecentTrends(timeframe.hours())) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("token", trend.token());
                item.put("count", trend.totalCount());
                item.put("source", trend.source());
                item.put("hot", trend.totalCount() > HOT_THRESHOLD);
                items.add(item);
            }
            return items;
        });
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        respond(exchange, () -> {
            TrendStats stats = queries.queryStats24h();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("totalRecords", stats.totalRecords());
            body.put("uniqueTokens", stats.uniqueTokens());
            body.put("alertsCount", stats.alertsCount());
            body.put("status", "active");
            return body;
        });
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "healthy", "timestamp", clock.instant().toString()));
    }

    private void handleCycleStatus(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, statusTracker.snapshot());
    }

    private void respond(HttpExchange exchange, QueryBody body) throws IOException {
        Object payload;
        try {
            payload = body.build();
        } catch (RuntimeException queryError) {
            LOGGER.log(Level.WARNING, "Query for " + exchange.getRequestURI() + " failed", queryError);
            writeJson(exchange, 500, Map.of("error", "query_failed"));
            return;
        }
        writeJson(exchange, 200, payload);
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    @FunctionalInterface
    private interface QueryBody {
        Object build();
    }
}
