package com.planningsync.infrastructure.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.TimeUnit;

/**
 * MongoDB client for the calendar publisher. Timeouts set in the properties
 * override the ones given in the connection string.
 */
@Configuration
@EnableConfigurationProperties(MongoStorageProperties.class)
public class MongoConfig {

    @Bean
    public MongoClient mongoClient(MongoStorageProperties properties) {
        return MongoClients.create(clientSettings(properties));
    }

    static MongoClientSettings clientSettings(MongoStorageProperties properties) {
        return MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(properties.getUri()))
            .applicationName("planning-sync")
            .applyToSocketSettings(socket -> socket.connectTimeout(
                (int) properties.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS))
            .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                properties.getServerSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS))
            .build();
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient, MongoStorageProperties properties) {
        return new MongoTemplate(mongoClient, properties.getDatabase());
    }
}
