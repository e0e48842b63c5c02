package com.trendsentinel.service.runtime;

import com.trendsentinel.collectors.cycle.CycleOutcome;
import com.trendsentinel.collectors.cycle.CycleStatus;
import com.trendsentinel.collectors.cycle.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleSchedulerTest {
    private static final Duration INTERVAL = Duration.ofSeconds(600);
    private static final Duration BACKOFF = Duration.ofSeconds(60);

    @Test
    void sleepsIntervalAfterCycleAndBackoffAfterUnexpectedFailure() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<CycleOutcome> cycle = () -> {
            if (calls.incrementAndGet() == 2) {
                throw new IllegalStateException("boom");
            }
            return outcome(calls.get());
        };
        List<Duration> sleeps = new ArrayList<>();
        AtomicReference<CycleScheduler> ref = new AtomicReference<>();
        Sleeper sleeper = duration -> {
            sleeps.add(duration);
            if (sleeps.size() == 3) {
                ref.get().stop();
            }
        };
        CycleScheduler scheduler = new CycleScheduler(cycle, INTERVAL, BACKOFF, sleeper);
        ref.set(scheduler);

        scheduler.runLoop();

        assertEquals(List.of(INTERVAL, BACKOFF, INTERVAL), sleeps);
        assertEquals(3, scheduler.cyclesRun());
        assertEquals(1, scheduler.unexpectedFailures());
        assertEquals(3, scheduler.lastOutcome().orElseThrow().cycleNumber());
    }

    @Test
    void stopDuringCycleLetsItFinishAndSkipsTheSleep() {
        List<Duration> sleeps = new ArrayList<>();
        AtomicReference<CycleScheduler> ref = new AtomicReference<>();
        AtomicInteger completed = new AtomicInteger();
        Supplier<CycleOutcome> cycle = () -> {
            ref.get().stop();
            completed.incrementAndGet();
            return outcome(1);
        };
        CycleScheduler scheduler = new CycleScheduler(cycle, INTERVAL, BACKOFF, sleeps::add);
        ref.set(scheduler);

        scheduler.runLoop();

        assertEquals(1, completed.get());
        assertTrue(sleeps.isEmpty());
        assertTrue(scheduler.stopRequested());
    }

    @Test
    void interruptedSleepEndsTheLoop() {
        AtomicInteger calls = new AtomicInteger();
        CycleScheduler scheduler = new CycleScheduler(
                () -> outcome(calls.incrementAndGet()),
                INTERVAL,
                BACKOFF,
                duration -> {
                    throw new InterruptedException("test");
                }
        );

        scheduler.runLoop();

        assertEquals(1, calls.get());
        assertTrue(Thread.interrupted());
    }

    @Test
    void runOnceReturnsTheNextWait() {
        CycleScheduler ok = new CycleScheduler(() -> outcome(1), INTERVAL, BACKOFF, duration -> { });
        CycleScheduler failing = new CycleScheduler(() -> {
            throw new RuntimeException("unexpected");
        }, INTERVAL, BACKOFF, duration -> { });

        assertEquals(INTERVAL, ok.runOnce());
        assertEquals(BACKOFF, failing.runOnce());
        assertFalse(failing.lastOutcome().isPresent());
    }

    @Test
    void defaultSleeperWakesUpOnShutdown() throws Exception {
        CountDownLatch firstCycle = new CountDownLatch(1);
        CycleScheduler scheduler = new CycleScheduler(() -> {
            firstCycle.countDown();
            return outcome(1);
        }, Duration.ofHours(1), BACKOFF);

        scheduler.start();
        assertTrue(firstCycle.await(5, TimeUnit.SECONDS));

        long startedAt = System.nanoTime();
        scheduler.shutdown(Duration.ofSeconds(5));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertTrue(elapsedMillis < 5_000, "shutdown should cut the hour-long wait short");
        assertEquals(1, scheduler.cyclesRun());
    }

    @Test
    void startTwiceIsRejected() {
        CycleScheduler scheduler = new CycleScheduler(() -> outcome(1), Duration.ofHours(1), BACKOFF);
        try {
            scheduler.start();
            assertThrows(IllegalStateException.class, scheduler::start);
        } finally {
            scheduler.shutdown(Duration.ofSeconds(5));
        }
    }

    private static CycleOutcome outcome(long cycleNumber) {
        return new CycleOutcome(
                cycleNumber,
                CycleStatus.COMPLETED,
                Instant.parse("2026-03-01T12:00:00Z"),
                1,
                1,
                1,
                List.of(),
                List.of()
        );
    }
}
