package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * The adapter exceeded its overall operation budget.
 */
public class ScrapeTimeoutException extends ScraperException {

    public ScrapeTimeoutException(String message) {
        super(message);
    }

    public ScrapeTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.TIMEOUT;
    }
}
