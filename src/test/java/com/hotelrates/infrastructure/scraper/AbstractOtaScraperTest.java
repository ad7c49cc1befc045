package com.hotelrates.infrastructure.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hotelrates.application.normalization.RateNormalizer;
import com.hotelrates.domain.exception.AdapterNotImplementedException;
import com.hotelrates.domain.exception.InvalidQueryException;
import com.hotelrates.domain.exception.ScrapeTimeoutException;
import com.hotelrates.domain.exception.SessionException;
import com.hotelrates.domain.exception.SiteLayoutChangedException;
import com.hotelrates.domain.exception.UnknownOtaException;
import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.domain.model.RawRateEntry;
import com.hotelrates.domain.model.ScrapeStatus;
import com.hotelrates.domain.ports.OtaScraper;
import com.hotelrates.infrastructure.ota.OtaRegistry;
import com.hotelrates.infrastructure.scraper.agoda.AgodaScraper;
import com.hotelrates.infrastructure.scraper.booking.BookingScraper;
import com.hotelrates.infrastructure.scraper.browser.BrowserSessionFactory;
import com.hotelrates.infrastructure.scraper.expedia.ExpediaScraper;
import com.hotelrates.infrastructure.scraper.pacing.ManualNanoClock;
import com.hotelrates.infrastructure.scraper.trip.TripScraper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the common scrape flow shared by all OTA adapters.
 */
class AbstractOtaScraperTest {

    private static final String TEST_OTA = "Booking.com";
    private static final RateQuery GRAND_HOTEL = RateQuery.of(
        "Grand Hotel", LocalDate.parse("2025-06-01"), LocalDate.parse("2025-06-03"));

    private ManualNanoClock clock;
    private TestSessionFactory sessionFactory;
    private ScraperSupport support;

    @BeforeEach
    void setUp() {
        clock = new ManualNanoClock(0);
        sessionFactory = new TestSessionFactory();
        OtaRegistry otaRegistry = new OtaRegistry(
            List.of("Booking.com", "Expedia.com", "Hotels.com", "Agoda", "Trip.com"), List.of());
        RateNormalizer normalizer = new RateNormalizer(
            otaRegistry, Clock.fixed(Instant.parse("2025-05-20T10:00:00Z"), ZoneOffset.UTC));
        support = new ScraperSupport(
            normalizer,
            sessionFactory,
            new BoundedWait(Duration.ofMillis(20)),
            clock,
            Duration.ofSeconds(2),
            Duration.ofMillis(100),
            Duration.ofSeconds(60)
        );
    }

    @Test
    void invalidDatesAreRejectedBeforeAnySessionIsOpened() {
        AtomicBoolean extracted = new AtomicBoolean();
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            extracted.set(true);
            return List.of();
        });
        RateQuery reversed = RateQuery.parse("Grand Hotel", "2025-06-05", "2025-06-01", 2);

        InvalidQueryException e = assertThrows(InvalidQueryException.class, () -> scraper.scrapeRates(reversed));

        assertEquals(ScrapeStatus.INVALID_QUERY, e.getStatus());
        assertFalse(extracted.get());
        assertEquals(0, sessionFactory.created);
    }

    @Test
    void blankHotelAndZeroAdultsAreInvalid() {
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> List.of());

        assertThrows(InvalidQueryException.class, () -> scraper.scrapeRates(
            new RateQuery("  ", GRAND_HOTEL.checkIn(), GRAND_HOTEL.checkOut(), 2)));
        assertThrows(InvalidQueryException.class, () -> scraper.scrapeRates(
            new RateQuery("Grand Hotel", GRAND_HOTEL.checkIn(), GRAND_HOTEL.checkOut(), 0)));
        assertEquals(0, sessionFactory.created);
    }

    @Test
    void noRawEntriesIsAnEmptyRecordNotAnError() {
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> List.of());

        CanonicalRateRecord record = scraper.scrapeRates(GRAND_HOTEL);

        assertEquals(TEST_OTA, record.otaName());
        assertEquals("Grand Hotel", record.hotelName());
        assertEquals("2025-06-01", record.checkInDate());
        assertEquals("2025-06-03", record.checkOutDate());
        assertEquals(2, record.adults());
        assertTrue(record.rates().isEmpty());
    }

    @Test
    void extractedRatesAreNormalizedInOrderWithPayload() {
        ObjectNode payload = new ObjectMapper().createObjectNode().put("page", "search");
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            context.setRawPayload(payload);
            return List.of(
                RawRateEntry.of(Map.of(RawRateEntry.PRICE, "$100", RawRateEntry.ROOM_NAME, "Deluxe King")),
                RawRateEntry.ofPrice("bad"),
                RawRateEntry.ofPrice("$50"));
        });

        CanonicalRateRecord record = scraper.scrapeRates(GRAND_HOTEL);

        assertEquals(3, record.rates().size());
        assertEquals(100.0, record.rates().get(0).amount());
        assertEquals("Deluxe King", record.rates().get(0).rawLabel());
        assertNull(record.rates().get(1).amount());
        assertEquals(50.0, record.rates().get(2).amount());
        assertEquals(payload, record.rawData());
    }

    @Test
    void sessionCreationAndNavigationAreGatedAndSessionIsQuit() {
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            context.navigate("https://example.test/search");
            context.navigate("https://example.test/hotel");
            return List.of();
        });

        scraper.scrapeRates(GRAND_HOTEL);

        assertEquals(1, sessionFactory.created);
        // session start is the first gated call; each navigation waits the full delay
        assertEquals(List.of(2_000_000_000L, 2_000_000_000L), clock.sleeps());

        InOrder inOrder = inOrder(sessionFactory.driver);
        inOrder.verify(sessionFactory.driver).get("https://example.test/search");
        inOrder.verify(sessionFactory.driver).get("https://example.test/hotel");
        inOrder.verify(sessionFactory.driver).quit();
    }

    @Test
    void pacingCarriesAcrossScrapesOfTheSameAdapter() {
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            context.navigate("https://example.test/search");
            return List.of();
        });

        scraper.scrapeRates(GRAND_HOTEL);
        scraper.scrapeRates(GRAND_HOTEL);

        // second session start waits for the first scrape's navigation
        assertEquals(List.of(2_000_000_000L, 2_000_000_000L, 2_000_000_000L), clock.sleeps());
        assertEquals(2, sessionFactory.created);
    }

    @Test
    void missingPageStructureIsSiteLayoutChanged() {
        when(sessionFactory.driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("absent"));
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            context.requireElement(By.id("hotel-results"));
            return List.of();
        });

        SiteLayoutChangedException e = assertThrows(SiteLayoutChangedException.class,
            () -> scraper.scrapeRates(GRAND_HOTEL));

        assertEquals(ScrapeStatus.SITE_LAYOUT_CHANGED, e.getStatus());
        verify(sessionFactory.driver).quit();
    }

    @Test
    void optionalElementAbsenceIsNotAnError() {
        when(sessionFactory.driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("absent"));
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context ->
            context.waitFor(By.className("sold-out-banner")).isPresent()
                ? List.of()
                : List.of(RawRateEntry.ofPrice("$80")));

        assertEquals(1, scraper.scrapeRates(GRAND_HOTEL).rateCount());
    }

    @Test
    void exceedingOperationBudgetIsTimeout() {
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            clock.advanceMillis(61_000);
            context.checkDeadline();
            return List.of();
        });

        ScrapeTimeoutException e = assertThrows(ScrapeTimeoutException.class, () -> scraper.scrapeRates(GRAND_HOTEL));
        assertEquals(ScrapeStatus.TIMEOUT, e.getStatus());
    }

    @Test
    void sessionThatCannotStartIsSessionError() {
        sessionFactory.failure = new WebDriverException("chrome not reachable");
        OtaScraper scraper = new ScriptedScraper(TEST_OTA, support, context -> {
            context.navigate("https://example.test/search");
            return List.of();
        });

        SessionException e = assertThrows(SessionException.class, () -> scraper.scrapeRates(GRAND_HOTEL));
        assertEquals(ScrapeStatus.SESSION_ERROR, e.getStatus());
    }

    @Test
    void adapterWithNonWhitelistedNameFailsNormalization() {
        OtaScraper scraper = new ScriptedScraper("booking.com", support, context -> List.of());

        assertThrows(UnknownOtaException.class, () -> scraper.scrapeRates(GRAND_HOTEL));
    }

    @Test
    void placeholderAdaptersSignalNotImplementedWithoutOpeningASession() {
        List<OtaScraper> adapters = List.of(
            new BookingScraper(support),
            new ExpediaScraper(support),
            new AgodaScraper(support),
            new TripScraper(support));

        for (OtaScraper adapter : adapters) {
            AdapterNotImplementedException e = assertThrows(AdapterNotImplementedException.class,
                () -> adapter.scrapeRates(GRAND_HOTEL));
            assertEquals(ScrapeStatus.NOT_IMPLEMENTED, e.getStatus());
            assertEquals(adapter.getOtaName(), e.getOtaName());
        }
        assertEquals(0, sessionFactory.created);
    }

    @Test
    void placeholderAdaptersStillValidateFirst() {
        RateQuery reversed = RateQuery.parse("Grand Hotel", "2025-06-05", "2025-06-01", null);

        assertThrows(InvalidQueryException.class, () -> new BookingScraper(support).scrapeRates(reversed));
    }

    /**
     * Adapter whose extraction is supplied by the test.
     */
    private static class ScriptedScraper extends AbstractOtaScraper {
        private final Function<ScrapeContext, List<RawRateEntry>> script;

        ScriptedScraper(String otaName, ScraperSupport support, Function<ScrapeContext, List<RawRateEntry>> script) {
            super(otaName, support);
            this.script = script;
        }

        @Override
        protected List<RawRateEntry> extractRates(ScrapeContext context) {
            return script.apply(context);
        }
    }

    /**
     * Session factory handing out one mock driver and counting sessions.
     */
    private static class TestSessionFactory implements BrowserSessionFactory {
        private final WebDriver driver = mock(WebDriver.class);
        private int created;
        private WebDriverException failure;

        @Override
        public WebDriver createSession() {
            if (failure != null) {
                throw failure;
            }
            created++;
            return driver;
        }
    }
}
