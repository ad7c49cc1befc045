package com.hotelrates.infrastructure.scraper;

import com.hotelrates.application.normalization.RateNormalizer;
import com.hotelrates.infrastructure.scraper.browser.BrowserSessionFactory;
import com.hotelrates.infrastructure.scraper.pacing.NanoClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Collaborators and limits shared by every OTA adapter.
 */
public final class ScraperSupport {

    private final RateNormalizer normalizer;
    private final BrowserSessionFactory sessionFactory;
    private final BoundedWait boundedWait;
    private final NanoClock clock;

    /** Minimum gap between gated actions of one adapter. */
    private final Duration minDelay;

    /** Default budget of a single element wait. */
    private final Duration waitTimeout;

    /** Budget of one whole scrape, checked cooperatively. */
    private final Duration operationTimeout;

    public ScraperSupport(RateNormalizer normalizer, BrowserSessionFactory sessionFactory,
                          BoundedWait boundedWait, NanoClock clock,
                          Duration minDelay, Duration waitTimeout, Duration operationTimeout) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.boundedWait = Objects.requireNonNull(boundedWait, "boundedWait");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout");
    }

    public RateNormalizer getNormalizer() {
        return normalizer;
    }

    public BrowserSessionFactory getSessionFactory() {
        return sessionFactory;
    }

    public BoundedWait getBoundedWait() {
        return boundedWait;
    }

    public NanoClock getClock() {
        return clock;
    }

    public Duration getMinDelay() {
        return minDelay;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }
}
