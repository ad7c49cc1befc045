package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * The browser session is unusable. Callers may recreate the session and retry the whole scrape.
 */
public class SessionException extends ScraperException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.SESSION_ERROR;
    }
}
