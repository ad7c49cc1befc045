package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * Caller error: empty hotel name, bad date ordering or a non-positive adult count. Never retried.
 */
public class InvalidQueryException extends ScraperException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.INVALID_QUERY;
    }
}
