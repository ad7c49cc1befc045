package com.hotelrates.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One rate as extracted by an adapter, before normalization.
 *
 * <p>The structure is opaque to the core. Only the keys below are read by the normalizer; any
 * other key is carried for the adapter's own use and dropped after normalization.
 */
public final class RawRateEntry {

    /** Price text (e.g. "$1,234.56") or a number. */
    public static final String PRICE = "price";

    /** ISO 4217 code, if the page shows one separately from the price. */
    public static final String CURRENCY = "currency";

    /** Room or offer label as displayed on the site. */
    public static final String ROOM_NAME = "room_name";

    private final Map<String, Object> values;

    private RawRateEntry(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RawRateEntry of(Map<String, ?> values) {
        return new RawRateEntry(values != null ? values : Map.of());
    }

    public static RawRateEntry ofPrice(String price) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(PRICE, price);
        return new RawRateEntry(values);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Returns the value for {@code key} as text, empty when absent or blank.
     */
    public Optional<String> getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    @Override
    public String toString() {
        return "RawRateEntry" + values;
    }
}
