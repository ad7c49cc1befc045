package com.hotelrates.infrastructure.rest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /rates/scrape}. Dates are ISO 8601 (yyyy-MM-dd); {@code otas} defaults to
 * every whitelisted OTA.
 */
public record ScrapeRequest(
    @JsonProperty("hotel_name") String hotelName,
    @JsonProperty("check_in") String checkIn,
    @JsonProperty("check_out") String checkOut,
    @JsonProperty("adults") Integer adults,
    @JsonProperty("otas") List<String> otas
) {}
