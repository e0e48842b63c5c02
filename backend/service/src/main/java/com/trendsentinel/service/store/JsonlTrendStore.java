package com.trendsentinel.service.store;

import com.trendsentinel.collectors.api.PersistenceException;
import com.trendsentinel.collectors.api.TrendStore;
import com.trendsentinel.core.model.TrendAlert;
import com.trendsentinel.core.model.TrendRecord;
import com.trendsentinel.core.model.TrendStats;
import com.trendsentinel.core.model.TrendingToken;
import com.trendsentinel.core.util.JsonUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only JSON-lines storage: one file of per-cycle token counts and one of alerts.
 * Batches are fully serialized before anything is written, and a failed write is truncated
 * away, so the files only ever hold whole cycles.
 */
public class JsonlTrendStore implements TrendStore, TrendQueries {
    public static final String TRENDS_FILE = "trends.jsonl";
    public static final String ALERTS_FILE = "alerts.jsonl";

    private static final Logger LOGGER = Logger.getLogger(JsonlTrendStore.class.getName());

    private static final Comparator<TrendingToken> BY_TOTAL_DESC = Comparator
            .comparingLong(TrendingToken::totalCount).reversed()
            .thenComparing(TrendingToken::token)
            .thenComparing(TrendingToken::source);

    private final Path trendsFile;
    private final Path alertsFile;
    private final Clock clock;
    private final BatchWriter batchWriter;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlTrendStore(Path dataDir, Clock clock) {
        this(dataDir, clock, JsonlTrendStore::appendToFile);
    }

    JsonlTrendStore(Path dataDir, Clock clock, BatchWriter batchWriter) {
        this.trendsFile = dataDir.resolve(TRENDS_FILE);
        this.alertsFile = dataDir.resolve(ALERTS_FILE);
        this.clock = clock;
        this.batchWriter = batchWriter;
    }

    @Override
    public void appendTrendRecords(List<TrendRecord> records) throws PersistenceException {
        appendCycle(records, List.of());
    }

    @Override
    public void appendAlerts(List<TrendAlert> alerts) throws PersistenceException {
        appendCycle(List.of(), alerts);
    }

    /**
     * Appends both batches under one lock. If any write fails, every file touched so far is
     * cut back to its length before the call, so readers never see part of a cycle.
     */
    @Override
    public void appendCycle(List<TrendRecord> records, List<TrendAlert> alerts) throws PersistenceException {
        List<PendingBatch> batches = new ArrayList<>(2);
        if (!records.isEmpty()) {
            batches.add(new PendingBatch(trendsFile, serialize(trendsFile, records), records.size()));
        }
        if (!alerts.isEmpty()) {
            batches.add(new PendingBatch(alertsFile, serialize(alertsFile, alerts), alerts.size()));
        }
        if (batches.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            List<FileMark> marks = new ArrayList<>(batches.size());
            for (PendingBatch batch : batches) {
                try {
                    Path parent = batch.file().toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    marks.add(new FileMark(batch.file(), Files.isRegularFile(batch.file()) ? Files.size(batch.file()) : -1));
                    batchWriter.write(batch.file(), batch.lines());
                } catch (IOException e) {
                    rollBack(marks, e);
                    throw new PersistenceException("Failed appending " + batch.rows() + " rows to " + batch.file(), e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TrendingToken> queryRecentTrends(double windowHours) {
        Instant cutoff = clock.instant().minus(hours(windowHours));
        Map<String, TrendingToken> totals = new LinkedHashMap<>();
        for (TrendRecord record : readAll(trendsFile, TrendRecord.class)) {
            if (!record.timestamp().isAfter(cutoff)) {
                continue;
            }
            totals.merge(
                    record.token() + '\u0000' + record.source(),
                    new TrendingToken(record.token(), record.count(), record.source()),
                    (current, added) -> new TrendingToken(current.token(), current.totalCount() + added.totalCount(), current.source())
            );
        }
        return totals.values().stream()
                .sorted(BY_TOTAL_DESC)
                .limit(RECENT_TRENDS_LIMIT)
                .toList();
    }

    @Override
    public TrendStats queryStats24h() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(24));
        long totalRecords = 0;
        Set<String> uniqueTokens = new HashSet<>();
        for (TrendRecord record : readAll(trendsFile, TrendRecord.class)) {
            if (record.timestamp().isAfter(cutoff)) {
                totalRecords++;
                uniqueTokens.add(record.token());
            }
        }
        long alertsCount = readAll(alertsFile, TrendAlert.class).stream()
                .filter(alert -> alert.timestamp().isAfter(cutoff))
                .count();
        return new TrendStats(totalRecords, uniqueTokens.size(), alertsCount);
    }

    private static String serialize(Path file, List<?> rows) throws PersistenceException {
        StringBuilder out = new StringBuilder();
        try {
            for (Object row : rows) {
                out.append(JsonUtils.toJson(row)).append('\n');
            }
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("Failed serializing batch for " + file.getFileName(), e);
        }
        return out.toString();
    }

    private static void appendToFile(Path file, String lines) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(
                file,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
        )) {
            writer.write(lines);
        }
    }

    private static void rollBack(List<FileMark> marks, IOException cause) {
        for (FileMark mark : marks) {
            try {
                if (mark.length() < 0) {
                    if (Files.isRegularFile(mark.file())) {
                        Files.delete(mark.file());
                    }
                } else {
                    try (FileChannel channel = FileChannel.open(mark.file(), StandardOpenOption.WRITE)) {
                        channel.truncate(mark.length());
                    }
                }
            } catch (IOException rollbackError) {
                cause.addSuppressed(rollbackError);
                LOGGER.log(Level.SEVERE, "Could not roll back " + mark.file() + " to " + mark.length() + " bytes", rollbackError);
            }
        }
    }

    private <T> List<T> readAll(Path file, Class<T> type) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<T> rows = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    rows.add(JsonUtils.fromJson(line, type));
                } catch (IllegalArgumentException decodeError) {
                    throw new IllegalStateException("Invalid JSONL row in " + file.getFileName() + " at line " + lineNumber, decodeError);
                }
            }
            return rows;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private static Duration hours(double windowHours) {
        return Duration.ofMillis(Math.round(windowHours * 3_600_000d));
    }

    @FunctionalInterface
    interface BatchWriter {
        void write(Path file, String lines) throws IOException;
    }

    private record PendingBatch(Path file, String lines, int rows) {
    }

    // length -1 marks a file that did not exist before the write
    private record FileMark(Path file, long length) {
    }
}
