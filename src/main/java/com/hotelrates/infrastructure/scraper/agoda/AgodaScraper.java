package com.hotelrates.infrastructure.scraper.agoda;

import com.hotelrates.domain.exception.AdapterNotImplementedException;
import com.hotelrates.domain.model.RawRateEntry;
import com.hotelrates.infrastructure.scraper.AbstractOtaScraper;
import com.hotelrates.infrastructure.scraper.ScrapeContext;
import com.hotelrates.infrastructure.scraper.ScraperSupport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scraper for Agoda. Placeholder until the site flow is written.
 */
@Component
public class AgodaScraper extends AbstractOtaScraper {

    public static final String OTA_NAME = "Agoda";

    public AgodaScraper(ScraperSupport support) {
        super(OTA_NAME, support);
    }

    @Override
    protected List<RawRateEntry> extractRates(ScrapeContext context) {
        throw new AdapterNotImplementedException(OTA_NAME);
    }
}
