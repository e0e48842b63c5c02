package com.trendsentinel.core.trend;

import com.trendsentinel.core.model.TrendAlert;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a cycle's token counts against the counts retained from the previous cycle.
 *
 * <p>Classification and state update are split: {@link #classify} never touches the retained
 * state, and {@link #commit} installs the staged state afterwards. Instances are not
 * thread-safe; a single cycle runs at a time.
 */
public class TrendClassifier {
    private final TrendThresholds thresholds;
    private TrendState previousState;

    public TrendClassifier() {
        this(TrendThresholds.defaults(), TrendState.empty());
    }

    public TrendClassifier(TrendThresholds thresholds) {
        this(thresholds, TrendState.empty());
    }

    public TrendClassifier(TrendThresholds thresholds, TrendState initialState) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.previousState = Objects.requireNonNull(initialState, "initialState is required");
    }

    public Classification classify(FrequencyTable current, Instant timestamp) {
        TrendState baseline = previousState;
        List<TrendAlert> alerts = new ArrayList<>();
        for (TokenCount candidate : current.top(thresholds.classifyTop())) {
            int count = candidate.count();
            if (count < thresholds.minCount()) {
                continue;
            }
            int previous = baseline.countOf(candidate.token());
            if (previous == 0) {
                if (count >= thresholds.newTokenMinCount()) {
                    alerts.add(TrendAlert.newToken(candidate.token(), count, timestamp));
                }
            } else {
                double changePercent = changePercent(previous, count);
                if (changePercent >= thresholds.spikePercent()) {
                    alerts.add(TrendAlert.spike(candidate.token(), count, changePercent, timestamp));
                }
            }
        }
        return new Classification(alerts, TrendState.topOf(current, thresholds.retainedTop()), baseline);
    }

    /**
     * @throws IllegalStateException if the state changed since {@code classification} was computed
     */
    public void commit(Classification classification) {
        if (classification.baseline() != previousState) {
            throw new IllegalStateException("Classification was computed against a stale baseline");
        }
        previousState = classification.stagedState();
    }

    public TrendState previousState() {
        return previousState;
    }

    public TrendThresholds thresholds() {
        return thresholds;
    }

    static double changePercent(int previous, int current) {
        return (current - previous) * 100.0 / previous;
    }
}
