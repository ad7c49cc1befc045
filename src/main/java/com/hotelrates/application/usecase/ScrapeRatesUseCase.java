package com.hotelrates.application.usecase;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hotelrates.domain.exception.ScraperException;
import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.model.OtaScrapeResult;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.domain.model.ScrapeStatus;
import com.hotelrates.domain.ports.OtaScraper;
import com.hotelrates.domain.ports.RateRecordRepository;
import com.hotelrates.infrastructure.ota.OtaRegistry;
import com.hotelrates.infrastructure.ota.ScraperRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for scraping one query from several OTAs in parallel.
 *
 * <p>Every requested OTA gets exactly one result. Adapters are not retried; retry policy belongs
 * to whoever calls this.
 */
@Service
public class ScrapeRatesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeRatesUseCase.class);

    private final ScraperRegistry scraperRegistry;
    private final OtaRegistry otaRegistry;
    private final RateRecordRepository rateRecordRepository;
    private final ExecutorService executorService;

    public ScrapeRatesUseCase(ScraperRegistry scraperRegistry, OtaRegistry otaRegistry,
                              RateRecordRepository rateRecordRepository) {
        this.scraperRegistry = scraperRegistry;
        this.otaRegistry = otaRegistry;
        this.rateRecordRepository = rateRecordRepository;
        this.executorService = Executors.newFixedThreadPool(Math.max(scraperRegistry.getOtaNames().size(), 4));
    }

    /**
     * Scrapes every whitelisted OTA.
     */
    public ScrapeSummary execute(RateQuery query) {
        return execute(query, List.of());
    }

    /**
     * Scrapes the given OTAs, or every whitelisted OTA when {@code otaNames} is empty, and stores
     * the successful records.
     *
     * @throws com.hotelrates.domain.exception.InvalidQueryException before any scraper runs
     */
    public ScrapeSummary execute(RateQuery query, Collection<String> otaNames) {
        query.validate();

        Set<String> targets = otaNames == null || otaNames.isEmpty()
            ? otaRegistry.getWhitelist()
            : new LinkedHashSet<>(otaNames);
        logger.info("Starting rate scrape for '{}' on {} OTAs", query.hotelName(), targets.size());

        Map<String, OtaScrapeResult> results = new LinkedHashMap<>();
        Map<String, CompletableFuture<OtaScrapeResult>> futures = new LinkedHashMap<>();

        for (String otaName : targets) {
            Optional<OtaScrapeResult> skipped = checkRunnable(otaName);
            if (skipped.isPresent()) {
                results.put(otaName, skipped.get());
                continue;
            }
            // placeholder keeps the result order equal to the request order
            results.put(otaName, null);
            OtaScraper scraper = scraperRegistry.find(otaName).orElseThrow();
            futures.put(otaName, CompletableFuture.supplyAsync(() -> executeScraper(scraper, query), executorService));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        List<CanonicalRateRecord> records = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<OtaScrapeResult>> entry : futures.entrySet()) {
            OtaScrapeResult result = entry.getValue().join();
            results.put(entry.getKey(), result);
            if (result.record() != null) {
                records.add(result.record());
            }
        }

        int stored = 0;
        String storageError = null;
        if (!records.isEmpty()) {
            try {
                stored = rateRecordRepository.upsertRecords(records);
                logger.info("Stored {} rate records", stored);
            } catch (Exception e) {
                logger.error("Error storing rate records", e);
                storageError = e.getMessage();
            }
        }

        return new ScrapeSummary(query, Collections.unmodifiableMap(results), stored, storageError);
    }

    private Optional<OtaScrapeResult> checkRunnable(String otaName) {
        if (!otaRegistry.isWhitelisted(otaName)) {
            logger.warn("Skipping {}: not whitelisted", otaName);
            return Optional.of(OtaScrapeResult.failure(otaName, ScrapeStatus.UNKNOWN_OTA, "OTA is not whitelisted"));
        }
        if (!otaRegistry.isEnabled(otaName)) {
            logger.info("Skipping {}: disabled", otaName);
            return Optional.of(OtaScrapeResult.failure(otaName, ScrapeStatus.DISABLED, "OTA is disabled"));
        }
        if (scraperRegistry.find(otaName).isEmpty()) {
            logger.warn("Skipping {}: no scraper registered", otaName);
            return Optional.of(OtaScrapeResult.failure(otaName, ScrapeStatus.UNSUPPORTED, "No scraper for OTA"));
        }
        return Optional.empty();
    }

    private OtaScrapeResult executeScraper(OtaScraper scraper, RateQuery query) {
        String otaName = scraper.getOtaName();
        logger.info("Starting scraper: {}", otaName);

        try {
            CanonicalRateRecord record = scraper.scrapeRates(query);
            logger.info("Scraper {} completed successfully with {} rates", otaName, record.rateCount());
            return OtaScrapeResult.success(record);
        } catch (ScraperException e) {
            if (e.getStatus().isFailure()) {
                logger.error("Scraper {} failed ({})", otaName, e.getStatus(), e);
            } else {
                logger.warn("Scraper {} skipped: {}", otaName, e.getMessage());
            }
            return OtaScrapeResult.failure(otaName, e.getStatus(), e.getMessage());
        } catch (Exception e) {
            logger.error("Scraper {} failed", otaName, e);
            return OtaScrapeResult.failure(otaName, ScrapeStatus.FAILED, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    public record ScrapeSummary(
        @JsonProperty("query") RateQuery query,
        @JsonProperty("results") Map<String, OtaScrapeResult> results,
        @JsonProperty("total_stored") int totalStored,
        @JsonProperty("storage_error") String storageError
    ) {}
}
