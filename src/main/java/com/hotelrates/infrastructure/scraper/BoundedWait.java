package com.hotelrates.infrastructure.scraper;

import com.hotelrates.domain.exception.SessionException;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.openqa.selenium.support.ui.ExpectedCondition;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Element lookups for asynchronously rendered pages.
 *
 * <p>"Not there yet" and "not there at all" are ordinary results: every method returns an empty
 * {@link Optional} or list instead of throwing. The only error that escapes is
 * {@link SessionException}, raised when the browser session itself is gone. Waits are bounded by
 * their timeout and never hang on a missing element.
 */
public class BoundedWait {

    private static final Logger logger = LoggerFactory.getLogger(BoundedWait.class);

    private final Duration pollInterval;

    public BoundedWait(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    /**
     * Polls until an element matching {@code locator} exists in the document.
     *
     * @return the element, or empty if none appeared within {@code timeout}
     * @throws SessionException if the session died while waiting
     */
    public Optional<WebElement> waitForPresence(WebDriver driver, By locator, Duration timeout) {
        return await(driver, locator, timeout, ExpectedConditions.presenceOfElementLocated(locator));
    }

    /**
     * Polls until an element matching {@code locator} is visible and enabled.
     *
     * @return the element, or empty if none became interactable within {@code timeout}
     * @throws SessionException if the session died while waiting
     */
    public Optional<WebElement> waitForInteractable(WebDriver driver, By locator, Duration timeout) {
        return await(driver, locator, timeout, ExpectedConditions.elementToBeClickable(locator));
    }

    /**
     * Single immediate lookup, no polling.
     */
    public Optional<WebElement> findOptional(WebDriver driver, By locator) {
        try {
            return Optional.ofNullable(driver.findElement(locator));
        } catch (NoSuchElementException e) {
            return Optional.empty();
        } catch (WebDriverException e) {
            return onLookupFailure(e, locator);
        }
    }

    /**
     * Single immediate lookup of every match, in document order. Empty when nothing matches.
     */
    public List<WebElement> findAllOptional(WebDriver driver, By locator) {
        try {
            List<WebElement> elements = driver.findElements(locator);
            return elements != null ? List.copyOf(elements) : List.of();
        } catch (NoSuchElementException e) {
            return List.of();
        } catch (WebDriverException e) {
            onLookupFailure(e, locator);
            return List.of();
        }
    }

    private Optional<WebElement> await(WebDriver driver, By locator, Duration timeout,
                                       ExpectedCondition<WebElement> condition) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got " + timeout);
        }

        WebDriverWait wait = new WebDriverWait(driver, timeout);
        wait.pollingEvery(pollInterval);

        try {
            return Optional.ofNullable(wait.until(condition));
        } catch (TimeoutException e) {
            logger.debug("No match for {} within {} ms", locator, timeout.toMillis());
            return Optional.empty();
        } catch (WebDriverException e) {
            return onLookupFailure(e, locator);
        }
    }

    private Optional<WebElement> onLookupFailure(WebDriverException e, By locator) {
        if (isSessionLost(e)) {
            throw new SessionException("Browser session lost while looking up " + locator, e);
        }
        logger.warn("Lookup of {} failed, treating as absent: {}", locator, e.getMessage());
        return Optional.empty();
    }

    /**
     * Whether {@code e} means the browser session can no longer be used.
     */
    static boolean isSessionLost(WebDriverException e) {
        return e instanceof NoSuchSessionException
            || e instanceof SessionNotCreatedException
            || e instanceof UnreachableBrowserException;
    }
}
