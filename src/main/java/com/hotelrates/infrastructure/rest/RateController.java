package com.hotelrates.infrastructure.rest;

import com.hotelrates.application.usecase.ScrapeRatesUseCase;
import com.hotelrates.domain.exception.InvalidQueryException;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.infrastructure.ota.OtaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for rate scraping.
 */
@RestController
@RequestMapping("/rates")
public class RateController {

    private static final Logger logger = LoggerFactory.getLogger(RateController.class);

    private final ScrapeRatesUseCase scrapeRatesUseCase;
    private final OtaRegistry otaRegistry;

    public RateController(ScrapeRatesUseCase scrapeRatesUseCase, OtaRegistry otaRegistry) {
        this.scrapeRatesUseCase = scrapeRatesUseCase;
        this.otaRegistry = otaRegistry;
    }

    /**
     * Scrapes one hotel stay from the requested OTAs.
     *
     * POST /rates/scrape
     *
     * @return one result per OTA, or 400 if the query is invalid
     */
    @PostMapping("/scrape")
    public ResponseEntity<?> scrape(@RequestBody ScrapeRequest request) {
        logger.info("Received request to scrape rates for '{}'", request.hotelName());

        try {
            RateQuery query = RateQuery.parse(
                request.hotelName(), request.checkIn(), request.checkOut(), request.adults());
            List<String> otas = request.otas() != null ? request.otas() : List.of();

            ScrapeRatesUseCase.ScrapeSummary summary = scrapeRatesUseCase.execute(query, otas);
            logger.info("Rate scrape completed. Total stored: {}", summary.totalStored());

            return ResponseEntity.ok(summary);
        } catch (InvalidQueryException e) {
            logger.warn("Rejected scrape request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error scraping rates", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Lists whitelisted OTAs with their enabled flag.
     *
     * GET /rates/otas
     */
    @GetMapping("/otas")
    public Map<String, Boolean> otas() {
        return otaRegistry.getStatuses();
    }
}
