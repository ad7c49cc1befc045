package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * The adapter for an OTA exists but has no working implementation yet.
 */
public class AdapterNotImplementedException extends ScraperException {

    private final String otaName;

    public AdapterNotImplementedException(String otaName) {
        super(otaName + " scraper not yet implemented");
        this.otaName = otaName;
    }

    public String getOtaName() {
        return otaName;
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.NOT_IMPLEMENTED;
    }
}
