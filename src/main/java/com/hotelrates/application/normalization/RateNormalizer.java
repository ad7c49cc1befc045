package com.hotelrates.application.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.hotelrates.domain.exception.UnknownOtaException;
import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.model.RateEntry;
import com.hotelrates.domain.model.RateQuery;
import com.hotelrates.domain.model.RawRateEntry;
import com.hotelrates.infrastructure.ota.OtaRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts an adapter's raw extraction into the canonical record.
 *
 * <p>Hotel name and stay dates are copied from the query, never re-derived from scraped data.
 * Every raw entry yields exactly one rate, in extraction order; a price that cannot be parsed
 * keeps its entry with a null amount. The raw payload is attached untouched.
 */
@Component
public class RateNormalizer {

    private final OtaRegistry otaRegistry;
    private final Clock clock;

    private Instant lastScrapedAt;

    public RateNormalizer(OtaRegistry otaRegistry, Clock clock) {
        this.otaRegistry = otaRegistry;
        this.clock = clock;
    }

    /**
     * @throws UnknownOtaException if {@code otaName} is not on the whitelist (exact match)
     */
    public CanonicalRateRecord normalize(String otaName, RateQuery query,
                                         List<RawRateEntry> rawEntries, JsonNode rawPayload) {
        if (otaName == null || !otaRegistry.isWhitelisted(otaName)) {
            throw new UnknownOtaException(otaName);
        }
        Objects.requireNonNull(query, "query");

        List<RateEntry> rates = new ArrayList<>();
        if (rawEntries != null) {
            for (RawRateEntry rawEntry : rawEntries) {
                rates.add(toRateEntry(rawEntry));
            }
        }

        return new CanonicalRateRecord(
            otaName,
            query.hotelName(),
            query.checkInDate(),
            query.checkOutDate(),
            query.adults(),
            nextScrapedAt(),
            rates,
            rawPayload
        );
    }

    private RateEntry toRateEntry(RawRateEntry rawEntry) {
        Object price = rawEntry.get(RawRateEntry.PRICE);
        String rawPrice = price != null ? price.toString() : null;

        Double amount;
        if (price instanceof Number) {
            double value = ((Number) price).doubleValue();
            amount = Double.isFinite(value) && value >= 0 ? value : null;
        } else {
            amount = PriceParser.parse(rawPrice);
        }

        String currency = rawEntry.getString(RawRateEntry.CURRENCY)
            .orElseGet(() -> PriceParser.detectCurrency(rawPrice).orElse(null));
        String label = rawEntry.getString(RawRateEntry.ROOM_NAME).orElse(null);

        return new RateEntry(amount, currency, label, rawPrice);
    }

    // Wall clocks can step backwards; scraped_at must not.
    private synchronized Instant nextScrapedAt() {
        Instant now = clock.instant();
        if (lastScrapedAt != null && now.isBefore(lastScrapedAt)) {
            now = lastScrapedAt;
        }
        lastScrapedAt = now;
        return now;
    }
}
