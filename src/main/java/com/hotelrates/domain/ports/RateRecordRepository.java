package com.hotelrates.domain.ports;

import com.hotelrates.domain.model.CanonicalRateRecord;

import java.util.List;

/**
 * Port for persisting canonical rate records.
 */
public interface RateRecordRepository {

    /**
     * Upserts records keyed by OTA, hotel, stay dates and adults. A newer scrape of the same key
     * replaces the stored rates.
     *
     * @param records records to store
     * @return Number of records inserted or updated
     */
    int upsertRecords(List<CanonicalRateRecord> records);

    /**
     * Finds a stored record by its record id.
     *
     * @param recordId id as produced by {@code NormalizationUtils.generateRecordId}
     * @return The record if found, null otherwise
     */
    CanonicalRateRecord findByRecordId(String recordId);
}
