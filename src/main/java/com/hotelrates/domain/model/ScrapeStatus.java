package com.hotelrates.domain.model;

/**
 * Outcome of one OTA scrape as reported to callers. Exactly one status per OTA per run.
 */
public enum ScrapeStatus {
    SUCCESS("success", false),
    NO_AVAILABILITY("no_availability", false),
    INVALID_QUERY("invalid_query", true),
    UNKNOWN_OTA("unknown_ota", true),
    SESSION_ERROR("session_error", true),
    SITE_LAYOUT_CHANGED("site_layout_changed", true),
    TIMEOUT("timeout", true),
    NOT_IMPLEMENTED("not_implemented", false),
    DISABLED("disabled", false),
    UNSUPPORTED("unsupported", false),
    FAILED("failed", true);

    private final String key;
    private final boolean failure;

    ScrapeStatus(String key, boolean failure) {
        this.key = key;
        this.failure = failure;
    }

    /**
     * Whether this status means the OTA broke. Unsupported, disabled and not-yet-implemented
     * OTAs are reported but not counted as failures.
     */
    public boolean isFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return key;
    }
}
