package com.docrepo.repositories.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.gridfs.GridFSBuckets;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One database connection shared by the repositories and blob stores built on it.
 */
public class MongoStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MongoStore.class);

    private final MongoConfig config;
    private final MongoClient client;
    private final MongoDatabase database;
    private final boolean ownsClient;

    public MongoStore(MongoConfig config) {
        this(config, MongoClients.create(config.uri), true);
        logger.info("Connected to {} database {}", config.uri, config.db);
    }

    /**
     * Uses a client managed by the caller; {@link #close()} leaves it open.
     */
    public MongoStore(MongoConfig config, MongoClient client) {
        this(config, client, false);
    }

    private MongoStore(MongoConfig config, MongoClient client, boolean ownsClient) {
        this.config = config;
        this.client = client;
        this.database = client.getDatabase(config.db);
        this.ownsClient = ownsClient;
    }

    public MongoConfig config() {
        return config;
    }

    public MongoCollection<Document> collection(String name) {
        return database.getCollection(name);
    }

    public GridFsBlobStore blobs(String bucketName) {
        return new GridFsBlobStore(GridFSBuckets.create(database, bucketName));
    }

    public GridFsBlobStore blobs() {
        return new GridFsBlobStore(GridFSBuckets.create(database));
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
            logger.info("Closed connection to database {}", config.db);
        }
    }
}
