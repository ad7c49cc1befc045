package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * Base class for every error a scraper may signal. Each subclass maps to one stable
 * {@link ScrapeStatus} so orchestration can report it without inspecting messages.
 */
public abstract class ScraperException extends RuntimeException {

    protected ScraperException(String message) {
        super(message);
    }

    protected ScraperException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ScrapeStatus getStatus();
}
