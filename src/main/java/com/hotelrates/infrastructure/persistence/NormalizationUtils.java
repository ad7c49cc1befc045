package com.hotelrates.infrastructure.persistence;

import java.text.Normalizer;

/**
 * Utilities for building stable storage keys from canonical records.
 */
public class NormalizationUtils {

    /**
     * Normalizes text for use in record IDs.
     *
     * Rules:
     * 1. Convert to uppercase
     * 2. Remove accents (Hôtel -> HOTEL)
     * 3. Replace non-alphanumeric with underscore
     * 4. Collapse multiple underscores
     * 5. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase();
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("_+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Generates the storage key of a rate record. One key per OTA, hotel, stay and party size.
     *
     * Format: <OTA>-<HOTEL>-<CHECK_IN>-<CHECK_OUT>-<ADULTS>
     * Example: BOOKING_COM-GRAND_HOTEL-20250601-20250603-2
     */
    public static String generateRecordId(String otaName, String hotelName,
                                          String checkInDate, String checkOutDate, int adults) {
        return String.format("%s-%s-%s-%s-%d",
            normalizeText(otaName),
            normalizeText(hotelName),
            compactDate(checkInDate),
            compactDate(checkOutDate),
            adults);
    }

    private static String compactDate(String isoDate) {
        return isoDate == null ? "" : isoDate.replaceAll("[^0-9]", "");
    }
}
