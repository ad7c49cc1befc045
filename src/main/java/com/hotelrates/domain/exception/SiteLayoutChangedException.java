package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * Expected page structure was still absent after the wait budget. Distinct from zero availability.
 */
public class SiteLayoutChangedException extends ScraperException {

    public SiteLayoutChangedException(String message) {
        super(message);
    }

    public SiteLayoutChangedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.SITE_LAYOUT_CHANGED;
    }
}
