package com.hotelrates.infrastructure.config;

import com.hotelrates.application.normalization.RateNormalizer;
import com.hotelrates.infrastructure.ota.OtaRegistry;
import com.hotelrates.infrastructure.scraper.BoundedWait;
import com.hotelrates.infrastructure.scraper.ScraperSupport;
import com.hotelrates.infrastructure.scraper.browser.BrowserSessionFactory;
import com.hotelrates.infrastructure.scraper.pacing.NanoClock;
import com.hotelrates.infrastructure.scraper.pacing.SystemNanoClock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

/**
 * Scraper configuration: OTA whitelist, pacing and wait budgets.
 */
@Configuration
public class ScraperConfig {

    /**
     * Whitelist loaded once at startup. A missing or malformed file fails application start.
     */
    @Bean
    public OtaRegistry otaRegistry(
            ResourceLoader resourceLoader,
            @Value("${hotelrates.otas.whitelist-location:classpath:otas.json}") String location,
            @Value("${hotelrates.otas.disabled:}") String[] disabled) {
        return OtaRegistry.load(resourceLoader.getResource(location), Arrays.asList(disabled));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NanoClock nanoClock() {
        return SystemNanoClock.instance();
    }

    @Bean
    public BoundedWait boundedWait(@Value("${hotelrates.scraper.poll-interval-ms:250}") long pollIntervalMs) {
        return new BoundedWait(Duration.ofMillis(pollIntervalMs));
    }

    @Bean
    public ScraperSupport scraperSupport(
            RateNormalizer normalizer,
            BrowserSessionFactory sessionFactory,
            BoundedWait boundedWait,
            NanoClock nanoClock,
            @Value("${hotelrates.scraper.min-delay-ms:2000}") long minDelayMs,
            @Value("${hotelrates.scraper.wait-timeout-ms:10000}") long waitTimeoutMs,
            @Value("${hotelrates.scraper.operation-timeout-ms:120000}") long operationTimeoutMs) {
        return new ScraperSupport(
            normalizer,
            sessionFactory,
            boundedWait,
            nanoClock,
            Duration.ofMillis(minDelayMs),
            Duration.ofMillis(waitTimeoutMs),
            Duration.ofMillis(operationTimeoutMs)
        );
    }
}
