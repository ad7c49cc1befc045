package com.hotelrates.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hotelrates.domain.model.CanonicalRateRecord;
import com.hotelrates.domain.ports.RateRecordRepository;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.WriteModel;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB implementation of RateRecordRepository.
 *
 * <p>Documents use the record's snake_case field names plus {@code record_id} and
 * {@code first_scraped_at}, the time the key was first seen. Re-scraping a key replaces its rates
 * but keeps {@code first_scraped_at}.
 */
@Repository
public class MongoRateRecordRepository implements RateRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoRateRecordRepository.class);
    private static final ObjectMapper OBJECT_MAPPER;
    private static final int BATCH_SIZE = 100;

    static final String RECORD_ID = "record_id";
    static final String FIRST_SCRAPED_AT = "first_scraped_at";

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoRateRecordRepository(
            MongoClient mongoClient,
            String mongoCollectionName,
            @Value("${mongodb.database:hotelrates}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = mongoCollectionName;

        initializeIndexes();
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    private void initializeIndexes() {
        try {
            MongoCollection<Document> collection = collection();

            collection.createIndex(
                Indexes.ascending(RECORD_ID),
                new IndexOptions().unique(true).background(true)
            );

            collection.createIndex(
                Indexes.ascending("ota_name"),
                new IndexOptions().background(true)
            );

            collection.createIndex(
                Indexes.compoundIndex(
                    Indexes.ascending("hotel_name"),
                    Indexes.ascending("check_in_date"),
                    Indexes.ascending("check_out_date")
                ),
                new IndexOptions().background(true)
            );

            collection.createIndex(
                Indexes.descending("scraped_at"),
                new IndexOptions().background(true)
            );

            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    /**
     * @throws com.mongodb.MongoException if a batch cannot be written
     */
    @Override
    public int upsertRecords(List<CanonicalRateRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        MongoCollection<Document> collection = collection();
        int totalUpserted = 0;

        for (int i = 0; i < records.size(); i += BATCH_SIZE) {
            int end = Math.min(i + BATCH_SIZE, records.size());
            totalUpserted += processBatch(collection, records.subList(i, end));
        }

        logger.info("Upserted {} rate records in batches of {}", totalUpserted, BATCH_SIZE);
        return totalUpserted;
    }

    private int processBatch(MongoCollection<Document> collection, List<CanonicalRateRecord> batch) {
        Map<String, Document> incoming = new HashMap<>();
        for (CanonicalRateRecord record : batch) {
            Document doc = recordToDocument(record);
            incoming.put(doc.getString(RECORD_ID), doc);
        }

        // first_scraped_at survives re-scrapes
        Map<String, Object> firstSeen = new HashMap<>();
        collection.find(Filters.in(RECORD_ID, new ArrayList<>(incoming.keySet())))
            .forEach(doc -> firstSeen.put(doc.getString(RECORD_ID), doc.get(FIRST_SCRAPED_AT)));

        List<WriteModel<Document>> bulkWrites = new ArrayList<>();
        for (Map.Entry<String, Document> entry : incoming.entrySet()) {
            Document doc = entry.getValue();
            Object first = firstSeen.get(entry.getKey());
            doc.put(FIRST_SCRAPED_AT, first != null ? first : doc.get("scraped_at"));

            bulkWrites.add(new ReplaceOneModel<>(
                Filters.eq(RECORD_ID, entry.getKey()),
                doc,
                new ReplaceOptions().upsert(true)
            ));
        }

        // write failures propagate so callers can report them
        var result = collection.bulkWrite(bulkWrites, new BulkWriteOptions().ordered(false));
        return result.getUpserts().size() + result.getModifiedCount();
    }

    @Override
    public CanonicalRateRecord findByRecordId(String recordId) {
        if (recordId == null) {
            return null;
        }

        Document doc = collection().find(Filters.eq(RECORD_ID, recordId)).first();
        if (doc == null) {
            return null;
        }

        try {
            return documentToRecord(doc);
        } catch (Exception e) {
            logger.error("Error converting document to rate record {}", recordId, e);
            return null;
        }
    }

    static Document recordToDocument(CanonicalRateRecord record) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(record, Map.class);
        Document doc = new Document(map);
        doc.put(RECORD_ID, NormalizationUtils.generateRecordId(
            record.otaName(), record.hotelName(), record.checkInDate(), record.checkOutDate(), record.adults()));
        return doc;
    }

    static CanonicalRateRecord documentToRecord(Document doc) {
        Document copy = new Document(doc);
        copy.remove("_id");
        return OBJECT_MAPPER.convertValue(copy, CanonicalRateRecord.class);
    }
}
