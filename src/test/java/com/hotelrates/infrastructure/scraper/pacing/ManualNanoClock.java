package com.hotelrates.infrastructure.scraper.pacing;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic clock for tests. Sleeping advances time instantly and is recorded.
 */
public final class ManualNanoClock implements NanoClock {
    private long now;
    private final List<Long> sleeps = new ArrayList<>();

    public ManualNanoClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public synchronized long nowNanos() {
        return now;
    }

    @Override
    public synchronized void sleepNanos(long nanos) {
        sleeps.add(nanos);
        now += nanos;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public synchronized void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    public synchronized List<Long> sleeps() {
        return new ArrayList<>(sleeps);
    }
}
