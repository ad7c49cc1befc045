package com.hotelrates.infrastructure.scraper;

import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.domain.model.RawRateEntry;
import com.hotelrates.domain.ports.OtaScraper;
import com.hotelrates.infrastructure.scraper.pacing.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Common scrape flow for browser-driven OTA adapters.
 *
 * Flow:
 * 1) Validate the query, before any session or network interaction
 * 2) Hand a {@link ScrapeContext} to {@link #extractRates}; the context gates session creation and
 *    navigation through this adapter's rate limiter and offers bounded element waits
 * 3) Normalize the raw entries into the canonical record
 *
 * <p>The rate limiter belongs to this adapter instance and paces every scrape it runs.
 */
public abstract class AbstractOtaScraper implements OtaScraper {

    private static final Logger logger = LoggerFactory.getLogger(AbstractOtaScraper.class);

    private final String otaName;
    private final ScraperSupport support;
    private final RateLimiter rateLimiter;

    protected AbstractOtaScraper(String otaName, ScraperSupport support) {
        this.otaName = otaName;
        this.support = support;
        this.rateLimiter = new RateLimiter(support.getMinDelay(), support.getClock());
    }

    @Override
    public String getOtaName() {
        return otaName;
    }

    @Override
    public CanonicalRateRecord scrapeRates(RateQuery query) {
        query.validate();
        logger.info("Starting {} scraper for '{}' {} -> {}, {} adults",
            otaName, query.hotelName(), query.checkIn(), query.checkOut(), query.adults());

        try (ScrapeContext context = new ScrapeContext(otaName, query, rateLimiter, support)) {
            List<RawRateEntry> rawEntries = extractRates(context);
            CanonicalRateRecord record = support.getNormalizer().normalize(
                otaName, query, rawEntries != null ? rawEntries : List.of(), context.getRawPayload());
            logger.info("{} returned {} rates for '{}'", otaName, record.rateCount(), query.hotelName());
            return record;
        }
    }

    /**
     * Drives the site and returns the raw rates in page order. An empty list means no
     * availability. Implementations use {@code context} for every session, navigation and element
     * lookup so pacing and wait bounds apply.
     */
    protected abstract List<RawRateEntry> extractRates(ScrapeContext context);
}
