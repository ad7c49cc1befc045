package com.hotelrates.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hotelrates.domain.exception.InvalidQueryException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Input to every scrape operation.
 *
 * <p>Construction does not validate so that a malformed query can still reach a scraper and be
 * rejected there with {@link InvalidQueryException}. Call {@link #validate()} before any session
 * or network interaction.
 */
public record RateQuery(
    @JsonProperty("hotel_name") String hotelName,
    @JsonProperty("check_in") LocalDate checkIn,
    @JsonProperty("check_out") LocalDate checkOut,
    @JsonProperty("adults") int adults
) {

    public static final int DEFAULT_ADULTS = 2;

    public static RateQuery of(String hotelName, LocalDate checkIn, LocalDate checkOut) {
        return new RateQuery(hotelName, checkIn, checkOut, DEFAULT_ADULTS);
    }

    /**
     * Builds a query from ISO 8601 (yyyy-MM-dd) date strings.
     *
     * @param adults number of adults, {@code null} for the default of 2
     * @throws InvalidQueryException if a date cannot be parsed
     */
    public static RateQuery parse(String hotelName, String checkIn, String checkOut, Integer adults) {
        return new RateQuery(
            hotelName,
            parseDate("check_in", checkIn),
            parseDate("check_out", checkOut),
            adults != null ? adults : DEFAULT_ADULTS
        );
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueryException(field + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException(field + " is not an ISO 8601 date: " + value, e);
        }
    }

    /**
     * Checks the query invariants: non-blank hotel name, check-in strictly before check-out,
     * at least one adult.
     *
     * @throws InvalidQueryException on the first violated invariant
     */
    public void validate() {
        if (hotelName == null || hotelName.isBlank()) {
            throw new InvalidQueryException("hotel_name must not be empty");
        }
        if (checkIn == null || checkOut == null) {
            throw new InvalidQueryException("check_in and check_out are required");
        }
        if (!checkIn.isBefore(checkOut)) {
            throw new InvalidQueryException(
                "check_in " + checkIn + " must be before check_out " + checkOut);
        }
        if (adults < 1) {
            throw new InvalidQueryException("adults must be at least 1, got " + adults);
        }
    }

    /** Check-in date in ISO 8601 form, as carried into the canonical record. */
    public String checkInDate() {
        return checkIn.toString();
    }

    public String checkOutDate() {
        return checkOut.toString();
    }
}
