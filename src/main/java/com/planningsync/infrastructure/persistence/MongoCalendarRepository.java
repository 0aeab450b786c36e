package com.planningsync.infrastructure.persistence;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.WriteModel;
import com.planningsync.domain.model.AssembledCalendar;
import com.planningsync.domain.model.CalendarEvent;
import com.planningsync.domain.ports.CalendarPublisher;
import com.planningsync.infrastructure.config.MongoStorageProperties;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * MongoDB publisher: upserts every event of the calendar keyed by its normalized id.
 */
@Repository
public class MongoCalendarRepository implements CalendarPublisher {

    private static final Logger logger = LoggerFactory.getLogger(MongoCalendarRepository.class);
    private static final String PUBLISHER_NAME = "mongodb";
    private static final int BATCH_SIZE = 100;

    private final MongoTemplate mongoTemplate;
    private final String collectionName;

    public MongoCalendarRepository(MongoTemplate mongoTemplate, MongoStorageProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = properties.getCollection();

        initializeIndexes();
    }

    private MongoCollection<Document> collection() {
        return mongoTemplate.getCollection(collectionName);
    }

    private void initializeIndexes() {
        try {
            MongoCollection<Document> collection = collection();

            collection.createIndex(
                Indexes.ascending("normalizedId"),
                new IndexOptions().unique(true).background(true)
            );
            collection.createIndex(
                Indexes.ascending("start"),
                new IndexOptions().background(true)
            );

            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public String getPublisherName() {
        return PUBLISHER_NAME;
    }

    @Override
    public int publish(AssembledCalendar calendar) {
        return upsertEvents(calendar.events(), calendar.assembledAt());
    }

    /**
     * Upserts events in batches.
     *
     * @param events   events to write
     * @param syncedAt time stamped on every written document
     * @return Number of events inserted or updated
     */
    public int upsertEvents(List<CalendarEvent> events, Instant syncedAt) {
        if (events == null || events.isEmpty()) {
            return 0;
        }

        MongoCollection<Document> collection = collection();
        int totalUpserted = 0;

        for (int i = 0; i < events.size(); i += BATCH_SIZE) {
            int end = Math.min(i + BATCH_SIZE, events.size());
            totalUpserted += processBatch(collection, events.subList(i, end), syncedAt);
        }

        logger.info("Upserted {} events in batches of {}", totalUpserted, BATCH_SIZE);
        return totalUpserted;
    }

    private int processBatch(MongoCollection<Document> collection, List<CalendarEvent> batch, Instant syncedAt) {
        List<WriteModel<Document>> bulkWrites = new ArrayList<>();

        for (CalendarEvent event : batch) {
            Document doc = eventToDocument(event, syncedAt);
            bulkWrites.add(new ReplaceOneModel<>(
                Filters.eq("normalizedId", doc.getString("normalizedId")),
                doc,
                new ReplaceOptions().upsert(true)
            ));
        }

        var result = collection.bulkWrite(bulkWrites, new BulkWriteOptions().ordered(false));
        return result.getUpserts().size() + result.getModifiedCount();
    }

    static Document eventToDocument(CalendarEvent event, Instant syncedAt) {
        return new Document("normalizedId", NormalizationUtils.generateNormalizedId(event))
            .append("start", event.start().toString())
            .append("end", event.end().toString())
            .append("durationMinutes", event.durationMinutes())
            .append("course", event.course())
            .append("room", event.room())
            .append("instructor", event.instructor())
            .append("groups", event.groups())
            .append("notes", event.notes())
            .append("syncedAt", Date.from(syncedAt));
    }
}
