package com.hotelrates.application.normalization;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PriceParser.
 */
class PriceParserTest {

    @Test
    void testParseWellFormedPrices() {
        assertEquals(1234.56, PriceParser.parse("$1,234.56"));
        assertEquals(1234.56, PriceParser.parse("1234.56"));
        assertEquals(42.0, PriceParser.parse("  42 "));

        // Thousands separators without currency
        assertEquals(1500000.0, PriceParser.parse("1,500,000"));

        // Other currency symbols
        assertEquals(89.9, PriceParser.parse("€89.90"));
        assertEquals(120.0, PriceParser.parse("£ 120"));

        // No-break space between symbol and amount
        assertEquals(75.0, PriceParser.parse("$\u00A075"));
    }

    @Test
    void testParseMalformedPricesAsNull() {
        assertNull(PriceParser.parse(""));
        assertNull(PriceParser.parse("N/A"));
        assertNull(PriceParser.parse("--"));
        assertNull(PriceParser.parse("$"));
        assertNull(PriceParser.parse("   "));
        assertNull(PriceParser.parse(null));
        assertNull(PriceParser.parse("USD 100"));
        assertNull(PriceParser.parse("12.34.56"));
        assertNull(PriceParser.parse("-5"));
    }

    @Test
    void testParseRejectsJavaNumberLiterals() {
        // Double.parseDouble would accept all of these
        assertNull(PriceParser.parse("NaN"));
        assertNull(PriceParser.parse("Infinity"));
        assertNull(PriceParser.parse("1e3"));
        assertNull(PriceParser.parse("10d"));
        assertNull(PriceParser.parse("0x1p3"));
    }

    @Test
    void testDetectCurrency() {
        assertEquals(Optional.of("USD"), PriceParser.detectCurrency("$1,234.56"));
        assertEquals(Optional.of("EUR"), PriceParser.detectCurrency("89 €"));
        assertEquals(Optional.of("JPY"), PriceParser.detectCurrency("¥12,000"));
        assertEquals(Optional.empty(), PriceParser.detectCurrency("1234.56"));
        assertEquals(Optional.empty(), PriceParser.detectCurrency(null));
    }
}
