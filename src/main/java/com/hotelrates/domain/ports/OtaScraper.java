package com.hotelrates.domain.ports;

import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.model.RateQuery;

/**
 * Port for scraping hotel rates from one online travel agency.
 */
public interface OtaScraper {

    /**
     * Gets the whitelisted identifier of the OTA this scraper handles.
     *
     * @return OTA name (e.g., "Booking.com", "Agoda")
     */
    String getOtaName();

    /**
     * Scrapes the rates for one query and normalizes them. A record with no rates means the
     * OTA has no availability, which is a success.
     *
     * @param query hotel, stay dates and party size
     * @return normalized record
     * @throws com.hotelrates.domain.exception.ScraperException subclass matching the failure kind
     */
    CanonicalRateRecord scrapeRates(RateQuery query);
}
