package com.docrepo.repositories.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * One in-memory server per test JVM. Every caller gets a freshly named collection.
 */
final class InMemoryMongo {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryMongo.class);
    static final String DATABASE_NAME = "test_db";

    private static MongoServer server;
    private static MongoClient mongoClient;

    private InMemoryMongo() {
    }

    static synchronized MongoClient client() {
        if (server == null) {
            try {
                server = new MongoServer(new MemoryBackend());
                String connectionString = server.bindAndGetConnectionString();
                mongoClient = MongoClients.create(connectionString);
                logger.info("Started in-memory MongoDB at {}", connectionString);
            } catch (Exception e) {
                logger.error("Failed to start in-memory MongoDB", e);
                throw e;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(InMemoryMongo::shutdown));
        }
        return mongoClient;
    }

    static MongoDatabase database() {
        return client().getDatabase(DATABASE_NAME);
    }

    static MongoCollection<Document> freshCollection() {
        String collectionName = "test_collection_" + UUID.randomUUID().toString().replace("-", "");
        logger.debug("Using collection {}", collectionName);
        return database().getCollection(collectionName);
    }

    static MongoStore store() {
        return new MongoStore(new MongoConfig("mongodb://in-memory", DATABASE_NAME), client());
    }

    private static synchronized void shutdown() {
        if (mongoClient != null) {
            mongoClient.close();
        }
        if (server != null) {
            server.shutdown();
        }
    }
}
