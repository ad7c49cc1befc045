package com.hotelrates.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-OTA result of a multi-OTA scrape: either a record or an error status, never both.
 */
public record OtaScrapeResult(
    @JsonProperty("ota_name") String otaName,
    @JsonProperty("status") ScrapeStatus status,
    @JsonProperty("record") CanonicalRateRecord record,
    @JsonProperty("error") String error
) {

    public static OtaScrapeResult success(CanonicalRateRecord record) {
        ScrapeStatus status = record.rates().isEmpty()
            ? ScrapeStatus.NO_AVAILABILITY
            : ScrapeStatus.SUCCESS;
        return new OtaScrapeResult(record.otaName(), status, record, null);
    }

    public static OtaScrapeResult failure(String otaName, ScrapeStatus status, String error) {
        return new OtaScrapeResult(otaName, status, null, error);
    }
}
