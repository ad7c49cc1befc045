package com.hotelrates.infrastructure.scraper.pacing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Enforces a minimum gap between the start times of successive gated operations.
 *
 * <p>One instance paces one scraper. The last-request time is recorded after any blocking
 * completes, so back-to-back calls compound instead of drifting. Concurrent callers on the same
 * instance are served in arrival order.
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Duration minDelay;
    private final long minDelayNanos;
    private final NanoClock clock;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long lastRequestNanos;
    private boolean hasPriorRequest;

    public RateLimiter(Duration minDelay) {
        this(minDelay, SystemNanoClock.instance());
    }

    public RateLimiter(Duration minDelay, NanoClock clock) {
        Objects.requireNonNull(minDelay, "minDelay");
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must be >= 0, got " + minDelay);
        }
        this.minDelay = minDelay;
        this.minDelayNanos = minDelay.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Blocks until at least {@code minDelay} has passed since the previous call, then records
     * this call. Never throws. An interrupt does not shorten the wait; the interrupt flag is
     * restored before returning.
     *
     * @return time spent blocked
     */
    public Duration acquire() {
        lock.lock();
        try {
            long start = clock.nowNanos();
            if (hasPriorRequest) {
                boolean interrupted = false;
                long elapsed = start - lastRequestNanos;
                while (elapsed < minDelayNanos) {
                    try {
                        clock.sleepNanos(minDelayNanos - elapsed);
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                    elapsed = clock.nowNanos() - lastRequestNanos;
                }
                if (interrupted) {
                    logger.debug("Interrupted while pacing; interrupt flag restored");
                    Thread.currentThread().interrupt();
                }
            }
            lastRequestNanos = clock.nowNanos();
            hasPriorRequest = true;
            return Duration.ofNanos(lastRequestNanos - start);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Paces, then runs {@code operation} and returns its result.
     */
    public <T> T gate(Supplier<T> operation) {
        acquire();
        return operation.get();
    }

    /**
     * Paces, then runs {@code operation}.
     */
    public void execute(Runnable operation) {
        acquire();
        operation.run();
    }

    public Duration getMinDelay() {
        return minDelay;
    }
}
