package com.nft.market.nft_market;

import org.bson.Document;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails startup if MongoDB is unreachable while persistence is enabled.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoStartUpCheck {

    private final MongoClient mongoClient;
    private final String databaseName;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            MongoDatabase database = mongoClient.getDatabase(databaseName);
            Document ping = database.runCommand(new Document("ping", 1));
            log.info("MongoDB connection successful: database={}, ok={}", databaseName, ping.get("ok"));
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed for database " + databaseName, e);
        }
    }
}
