package com.hotelrates.domain.exception;

import com.hotelrates.domain.model.ScrapeStatus;

/**
 * An adapter produced a record for an OTA identifier outside the whitelist.
 */
public class UnknownOtaException extends ScraperException {

    private final String otaName;

    public UnknownOtaException(String otaName) {
        super("OTA is not whitelisted: '" + otaName + "'");
        this.otaName = otaName;
    }

    public String getOtaName() {
        return otaName;
    }

    @Override
    public ScrapeStatus getStatus() {
        return ScrapeStatus.UNKNOWN_OTA;
    }
}
