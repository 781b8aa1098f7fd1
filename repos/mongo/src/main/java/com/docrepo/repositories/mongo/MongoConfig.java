package com.docrepo.repositories.mongo;

/**
 * Connection settings for a {@link MongoStore}.
 */
public class MongoConfig {
    public String uri;
    public String db;
    /**
     * Skip {@code size * page} records for pages after the first instead of
     * {@code size * (page - 1)}. Only for clients built against that numbering.
     */
    public boolean legacyPageSkip;

    public MongoConfig() {
    }

    public MongoConfig(String uri, String db) {
        this.uri = uri;
        this.db = db;
    }
}
