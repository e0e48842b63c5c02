package com.trendsentinel.collectors.cycle;

import com.trendsentinel.collectors.api.DocumentSource;
import com.trendsentinel.collectors.api.FetchException;
import com.trendsentinel.collectors.api.PersistenceException;
import com.trendsentinel.collectors.api.TrendStore;
import com.trendsentinel.core.bus.EventBus;
import com.trendsentinel.core.events.CycleCompleted;
import com.trendsentinel.core.events.CycleStarted;
import com.trendsentinel.core.events.SourceFetchFailed;
import com.trendsentinel.core.model.RawDocument;
import com.trendsentinel.core.model.TrendRecord;
import com.trendsentinel.core.text.Tokenizer;
import com.trendsentinel.core.trend.Classification;
import com.trendsentinel.core.trend.FrequencyAggregator;
import com.trendsentinel.core.trend.FrequencyTable;
import com.trendsentinel.core.trend.TrendClassifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one fetch, tokenize, aggregate, classify, persist pass.
 *
 * <p>Records and alerts are persisted as one unit, and the classifier's baseline is only
 * advanced after that write succeeds, so a cycle that is skipped or fails to persist leaves
 * the next cycle comparing against the last committed snapshot. Runtime failures propagate
 * to the caller untouched.
 */
public class CycleOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(CycleOrchestrator.class.getName());

    private final DocumentSource source;
    private final TrendStore store;
    private final Tokenizer tokenizer;
    private final FrequencyAggregator aggregator;
    private final TrendClassifier classifier;
    private final CycleSettings settings;
    private final Sleeper sleeper;
    private final Clock clock;
    private final EventBus eventBus;
    private long cycleCount;

    public CycleOrchestrator(
            DocumentSource source,
            TrendStore store,
            Tokenizer tokenizer,
            FrequencyAggregator aggregator,
            TrendClassifier classifier,
            CycleSettings settings,
            Sleeper sleeper,
            Clock clock,
            EventBus eventBus
    ) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
    }

    public CycleOutcome runCycle() {
        long cycleNumber = ++cycleCount;
        Instant startedAt = clock.instant();
        LOGGER.info("Starting trend cycle " + cycleNumber);
        eventBus.publish(new CycleStarted(startedAt, cycleNumber, settings.sourceIds()));

        CycleOutcome outcome = execute(cycleNumber);

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new CycleCompleted(
                clock.instant(),
                cycleNumber,
                outcome.status().name(),
                outcome.tokens(),
                outcome.alerts().size(),
                durationMillis
        ));
        return outcome;
    }

    public TrendClassifier classifier() {
        return classifier;
    }

    private CycleOutcome execute(long cycleNumber) {
        List<String> failedSources = new ArrayList<>();
        List<RawDocument> documents = fetchAll(failedSources);
        if (failedSources.size() == settings.sourceIds().size()) {
            LOGGER.warning("All " + failedSources.size() + " sources failed; skipping cycle " + cycleNumber);
            return CycleOutcome.skipped(cycleNumber, CycleStatus.SKIPPED_ALL_SOURCES_FAILED, clock.instant(), 0, failedSources);
        }

        List<String> tokens = new ArrayList<>();
        for (RawDocument document : documents) {
            tokens.addAll(tokenizer.tokenize(document.text()));
        }
        if (tokens.isEmpty()) {
            LOGGER.warning("No tokens collected from " + documents.size() + " documents; skipping cycle " + cycleNumber);
            return CycleOutcome.skipped(cycleNumber, CycleStatus.SKIPPED_NO_TOKENS, clock.instant(), documents.size(), failedSources);
        }
        LOGGER.info("Collected " + tokens.size() + " tokens from " + documents.size() + " documents");

        FrequencyTable table = aggregator.aggregate(tokens);
        Instant timestamp = clock.instant();
        Classification classification = classifier.classify(table, timestamp);

        try {
            store.appendCycle(toRecords(table, timestamp), classification.alerts());
        } catch (PersistenceException e) {
            LOGGER.log(Level.SEVERE, "Persisting cycle " + cycleNumber + " failed; baseline left unchanged", e);
            return new CycleOutcome(cycleNumber, CycleStatus.PERSISTENCE_FAILED, timestamp, documents.size(),
                    table.total(), table.distinctTokens(), classification.alerts(), failedSources);
        }
        classifier.commit(classification);

        LOGGER.info("Saved " + table.distinctTokens() + " tokens and " + classification.alerts().size() + " alerts");
        for (String line : AlertSummary.lines(classification.alerts(), AlertSummary.DEFAULT_LIMIT)) {
            LOGGER.info(line);
        }
        return new CycleOutcome(cycleNumber, CycleStatus.COMPLETED, timestamp, documents.size(),
                table.total(), table.distinctTokens(), classification.alerts(), failedSources);
    }

    private List<RawDocument> fetchAll(List<String> failedSources) {
        List<RawDocument> documents = new ArrayList<>();
        List<String> sourceIds = settings.sourceIds();
        for (int i = 0; i < sourceIds.size(); i++) {
            String sourceId = sourceIds.get(i);
            if (i > 0 && !pauseBetweenFetches()) {
                failedSources.addAll(sourceIds.subList(i, sourceIds.size()));
                break;
            }
            try {
                List<RawDocument> fetched = source.fetch(sourceId);
                documents.addAll(fetched);
                LOGGER.fine("Fetched " + fetched.size() + " documents from " + source.name() + "/" + sourceId);
            } catch (FetchException e) {
                failedSources.add(sourceId);
                LOGGER.log(Level.WARNING, "Fetch failed for " + source.name() + "/" + sourceId + ": " + e.getMessage());
                eventBus.publish(new SourceFetchFailed(clock.instant(), sourceId, e.getMessage()));
            }
        }
        return documents;
    }

    private boolean pauseBetweenFetches() {
        if (settings.fetchDelay().isZero()) {
            return true;
        }
        try {
            sleeper.sleep(settings.fetchDelay());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted between fetches; remaining sources are skipped this cycle");
            return false;
        }
    }

    private List<TrendRecord> toRecords(FrequencyTable table, Instant timestamp) {
        List<TrendRecord> records = new ArrayList<>(table.distinctTokens());
        table.asMap().forEach((token, count) -> records.add(new TrendRecord(token, count, source.name(), timestamp)));
        return records;
    }
}
