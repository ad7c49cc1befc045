package com.hotelrates.infrastructure.scraper.pacing;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic time source used for request pacing and operation deadlines.
 */
public interface NanoClock {

    long nowNanos();

    default void sleepNanos(long nanos) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
