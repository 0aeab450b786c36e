package com.planningsync.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the MongoDB publisher.
 */
@ConfigurationProperties(prefix = "mongodb")
public class MongoStorageProperties {

    private String uri = "mongodb://localhost:27017";

    private String database = "planning";

    /** Collection the calendar events are upserted into. */
    private String collection = "events";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration serverSelectionTimeout = Duration.ofSeconds(5);

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getServerSelectionTimeout() {
        return serverSelectionTimeout;
    }

    public void setServerSelectionTimeout(Duration serverSelectionTimeout) {
        this.serverSelectionTimeout = serverSelectionTimeout;
    }
}
