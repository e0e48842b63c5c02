package com.trendsentinel.service.runtime;

import com.trendsentinel.collectors.cycle.CycleOutcome;
import com.trendsentinel.collectors.cycle.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs trend cycles back to back on a single thread. The next cycle starts {@code interval}
 * after the previous one ended, or {@code errorBackoff} after one that failed unexpectedly.
 * A stop request is honored between cycles; a cycle in progress always runs to completion.
 */
public class CycleScheduler {
    private static final Logger LOGGER = Logger.getLogger(CycleScheduler.class.getName());

    private final Supplier<CycleOutcome> cycle;
    private final Duration interval;
    private final Duration errorBackoff;
    private final Sleeper sleeper;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong cyclesRun = new AtomicLong();
    private final AtomicLong unexpectedFailures = new AtomicLong();
    private final ExecutorService loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "trend-cycle");
        thread.setDaemon(false);
        return thread;
    });
    private volatile boolean stopRequested;
    private volatile CycleOutcome lastOutcome;

    public CycleScheduler(Supplier<CycleOutcome> cycle, Duration interval, Duration errorBackoff) {
        this(cycle, interval, errorBackoff, null);
    }

    /**
     * @param sleeper waits between cycles; {@code null} waits on the stop signal so that
     *                {@link #stop()} ends the wait early
     */
    public CycleScheduler(Supplier<CycleOutcome> cycle, Duration interval, Duration errorBackoff, Sleeper sleeper) {
        this.cycle = Objects.requireNonNull(cycle, "cycle is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff is required");
        this.sleeper = sleeper != null
                ? sleeper
                : duration -> stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already started");
        }
        loopExecutor.submit(this::runLoop);
    }

    /**
     * Runs cycles on the calling thread until {@link #stop()} is called or the thread is interrupted.
     */
    public void runLoop() {
        LOGGER.info("Trend monitor started; cycle interval " + interval + ", error backoff " + errorBackoff);
        while (!stopRequested) {
            Duration wait = runOnce();
            if (stopRequested) {
                break;
            }
            LOGGER.fine("Sleeping " + wait + " before next cycle");
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOGGER.info("Trend monitor stopped after " + cyclesRun.get() + " cycles");
    }

    /**
     * Runs a single cycle, absorbing unexpected runtime failures.
     *
     * @return how long to wait before the next cycle
     */
    public Duration runOnce() {
        cyclesRun.incrementAndGet();
        try {
            lastOutcome = cycle.get();
            return interval;
        } catch (RuntimeException e) {
            unexpectedFailures.incrementAndGet();
            LOGGER.log(Level.SEVERE, "Unexpected error in trend cycle; retrying in " + errorBackoff, e);
            return errorBackoff;
        }
    }

    public void stop() {
        stopRequested = true;
        stopSignal.countDown();
    }

    public void shutdown(Duration timeout) {
        stop();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Trend cycle still running after " + timeout + "; exiting without waiting further");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean stopRequested() {
        return stopRequested;
    }

    public long cyclesRun() {
        return cyclesRun.get();
    }

    public long unexpectedFailures() {
        return unexpectedFailures.get();
    }

    public Optional<CycleOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }
}
