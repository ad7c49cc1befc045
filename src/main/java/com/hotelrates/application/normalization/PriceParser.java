package com.hotelrates.application.normalization;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses price text scraped from OTA pages.
 *
 * Rules:
 * 1. Strip known currency symbols
 * 2. Strip comma thousands separators and surrounding whitespace
 * 3. What remains must be a plain unsigned decimal, otherwise the price is unparseable
 */
public class PriceParser {

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private static final Map<Character, String> SYMBOL_CURRENCIES = Map.of(
        '$', "USD",
        '€', "EUR",
        '£', "GBP",
        '¥', "JPY",
        '₹', "INR",
        '₩', "KRW",
        '฿', "THB"
    );

    /**
     * Parses a price string such as "$1,234.56", "1234.56" or "  42 ".
     *
     * @return the amount, or null for empty, purely symbolic or otherwise non-numeric text
     */
    public static Double parse(String price) {
        if (price == null) {
            return null;
        }

        StringBuilder cleaned = new StringBuilder(price.length());
        for (int i = 0; i < price.length(); i++) {
            char c = price.charAt(i);
            if (SYMBOL_CURRENCIES.containsKey(c) || c == ',') {
                continue;
            }
            // no-break spaces count as whitespace here
            cleaned.append(c == '\u00A0' || c == '\u202F' ? ' ' : c);
        }

        String candidate = cleaned.toString().strip();
        if (!PLAIN_DECIMAL.matcher(candidate).matches()) {
            return null;
        }

        double amount = Double.parseDouble(candidate);
        return Double.isFinite(amount) ? amount : null;
    }

    /**
     * Infers the ISO 4217 code from the first currency symbol in the text. "$" is read as USD.
     */
    public static Optional<String> detectCurrency(String price) {
        if (price == null) {
            return Optional.empty();
        }
        for (int i = 0; i < price.length(); i++) {
            String code = SYMBOL_CURRENCIES.get(price.charAt(i));
            if (code != null) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
