package com.hotelrates.infrastructure.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.hotelrates.domain.exception.ScrapeTimeoutException;
import com.hotelrates.domain.exception.SessionException;
import com.hotelrates.domain.exception.SiteLayoutChangedException;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.infrastructure.scraper.browser.BrowserSessionFactory;
import com.hotelrates.infrastructure.scraper.pacing.NanoClock;
import com.hotelrates.infrastructure.scraper.pacing.RateLimiter;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * State of one scrape call, handed to adapter code.
 *
 * <p>The browser session is opened lazily on first use, through the adapter's rate limiter, and
 * belongs to this call alone. Page navigation is gated through the same limiter. Closing the
 * context quits the session.
 */
public class ScrapeContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeContext.class);

    private final String otaName;
    private final RateQuery query;
    private final RateLimiter rateLimiter;
    private final BrowserSessionFactory sessionFactory;
    private final BoundedWait boundedWait;
    private final NanoClock clock;
    private final Duration waitTimeout;
    private final Duration operationTimeout;
    private final long deadlineNanos;

    private WebDriver session;
    private JsonNode rawPayload;

    ScrapeContext(String otaName, RateQuery query, RateLimiter rateLimiter, ScraperSupport support) {
        this.otaName = otaName;
        this.query = query;
        this.rateLimiter = rateLimiter;
        this.sessionFactory = support.getSessionFactory();
        this.boundedWait = support.getBoundedWait();
        this.clock = support.getClock();
        this.waitTimeout = support.getWaitTimeout();
        this.operationTimeout = support.getOperationTimeout();
        this.deadlineNanos = clock.nowNanos() + operationTimeout.toNanos();
    }

    public String getOtaName() {
        return otaName;
    }

    public RateQuery getQuery() {
        return query;
    }

    /**
     * Returns this call's browser session, starting it on first use.
     *
     * @throws SessionException if the session cannot be started
     */
    public WebDriver session() {
        if (session == null) {
            checkDeadline();
            try {
                session = rateLimiter.gate(sessionFactory::createSession);
            } catch (WebDriverException e) {
                throw new SessionException("Could not start browser session for " + otaName, e);
            }
            logger.debug("Opened browser session for {}", otaName);
        }
        return session;
    }

    /**
     * Loads {@code url} in the session once the rate limiter allows it.
     */
    public void navigate(String url) {
        WebDriver driver = session();
        checkDeadline();
        try {
            rateLimiter.execute(() -> driver.get(url));
        } catch (WebDriverException e) {
            if (BoundedWait.isSessionLost(e)) {
                throw new SessionException("Browser session lost while loading " + url, e);
            }
            throw e;
        }
    }

    public BoundedWait waits() {
        return boundedWait;
    }

    /** Waits the default budget for {@code locator} to be present. */
    public Optional<WebElement> waitFor(By locator) {
        return boundedWait.waitForPresence(session(), locator, waitTimeout);
    }

    public Optional<WebElement> waitForInteractable(By locator) {
        return boundedWait.waitForInteractable(session(), locator, waitTimeout);
    }

    public List<WebElement> findAll(By locator) {
        return boundedWait.findAllOptional(session(), locator);
    }

    /**
     * Waits for page structure the adapter depends on.
     *
     * @throws SiteLayoutChangedException if it is still absent after the wait budget
     */
    public WebElement requireElement(By locator) {
        return waitFor(locator).orElseThrow(() -> new SiteLayoutChangedException(
            otaName + ": expected " + locator + " not found within " + waitTimeout.toMillis() + " ms"));
    }

    /**
     * @throws ScrapeTimeoutException once the scrape has run longer than its operation budget
     */
    public void checkDeadline() {
        if (clock.nowNanos() - deadlineNanos > 0) {
            throw new ScrapeTimeoutException(
                otaName + " scrape exceeded " + operationTimeout.toMillis() + " ms");
        }
    }

    /** Attaches the page data kept for audit on the canonical record. */
    public void setRawPayload(JsonNode rawPayload) {
        this.rawPayload = rawPayload;
    }

    public JsonNode getRawPayload() {
        return rawPayload;
    }

    @Override
    public void close() {
        if (session == null) {
            return;
        }
        try {
            session.quit();
        } catch (WebDriverException e) {
            logger.warn("Failed to quit browser session for {}: {}", otaName, e.getMessage());
        } finally {
            session = null;
        }
    }
}
