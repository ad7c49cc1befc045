package com.hotelrates.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One normalized rate inside a {@link CanonicalRateRecord}.
 *
 * @param amount   parsed price, {@code null} when the site showed a price that could not be parsed
 * @param currency ISO 4217 code when known
 * @param rawLabel room or offer label as displayed
 * @param rawPrice price text exactly as extracted
 */
public record RateEntry(
    @JsonProperty("amount") Double amount,
    @JsonProperty("currency") String currency,
    @JsonProperty("raw_label") String rawLabel,
    @JsonProperty("raw_price") String rawPrice
) {
}
