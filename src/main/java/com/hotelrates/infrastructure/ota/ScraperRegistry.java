package com.hotelrates.infrastructure.ota;

import com.hotelrates.domain.exception.OtaConfigurationException;
import com.hotelrates.domain.ports.OtaScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of OTA adapters keyed by OTA name.
 *
 * <p>Startup fails if two adapters claim the same OTA or an adapter claims an OTA that is not
 * whitelisted.
 */
@Component
public class ScraperRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ScraperRegistry.class);

    private final Map<String, OtaScraper> scrapers;

    public ScraperRegistry(List<OtaScraper> scrapers, OtaRegistry otaRegistry) {
        Map<String, OtaScraper> byName = new LinkedHashMap<>();
        for (OtaScraper scraper : scrapers) {
            String name = scraper.getOtaName();
            if (!otaRegistry.isWhitelisted(name)) {
                throw new OtaConfigurationException(
                    scraper.getClass().getSimpleName() + " targets non-whitelisted OTA '" + name + "'");
            }
            OtaScraper previous = byName.putIfAbsent(name, scraper);
            if (previous != null) {
                throw new OtaConfigurationException("Duplicate scrapers for " + name + ": "
                    + previous.getClass().getSimpleName() + ", " + scraper.getClass().getSimpleName());
            }
        }
        this.scrapers = Collections.unmodifiableMap(byName);
        logger.info("Registered scrapers: {}", this.scrapers.keySet());
    }

    public Optional<OtaScraper> find(String otaName) {
        return Optional.ofNullable(scrapers.get(otaName));
    }

    public Set<String> getOtaNames() {
        return scrapers.keySet();
    }
}
