package com.hotelrates.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Site-agnostic output of every scraper. This field set is the compatibility contract for
 * downstream consumers: fields may be added, never renamed or removed.
 *
 * <p>Immutable. Holds no reference to the adapter or browser session that produced it.
 */
public record CanonicalRateRecord(
    @JsonProperty("ota_name") String otaName,
    @JsonProperty("hotel_name") String hotelName,
    @JsonProperty("check_in_date") String checkInDate,
    @JsonProperty("check_out_date") String checkOutDate,
    @JsonProperty("adults") int adults,
    @JsonProperty("scraped_at") Instant scrapedAt,
    @JsonProperty("rates") List<RateEntry> rates,
    @JsonProperty("raw_data") JsonNode rawData
) {

    public CanonicalRateRecord {
        Objects.requireNonNull(otaName, "otaName");
        Objects.requireNonNull(hotelName, "hotelName");
        Objects.requireNonNull(checkInDate, "checkInDate");
        Objects.requireNonNull(checkOutDate, "checkOutDate");
        Objects.requireNonNull(scrapedAt, "scrapedAt");
        rates = rates != null ? List.copyOf(rates) : List.of();
        rawData = rawData != null ? rawData.deepCopy() : null;
    }

    /** Audit payload; a copy, so callers cannot mutate the record through it. */
    @Override
    public JsonNode rawData() {
        return rawData != null ? rawData.deepCopy() : null;
    }

    public int rateCount() {
        return rates.size();
    }
}
