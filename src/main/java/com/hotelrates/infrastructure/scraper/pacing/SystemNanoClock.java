package com.hotelrates.infrastructure.scraper.pacing;

/**
 * {@link NanoClock} backed by {@link System#nanoTime()}. Shared by every scraper in the process.
 */
public final class SystemNanoClock implements NanoClock {
    private static final SystemNanoClock INSTANCE = new SystemNanoClock();

    private SystemNanoClock() {
    }

    public static SystemNanoClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
