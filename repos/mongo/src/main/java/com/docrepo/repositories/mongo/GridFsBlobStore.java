package com.docrepo.repositories.mongo;

import com.docrepo.core.BlobStore;
import com.docrepo.core.errors.NotFoundException;
import com.mongodb.MongoGridFSException;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.model.Filters;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

/**
 * Files stored in the database through GridFS.
 */
public class GridFsBlobStore implements BlobStore<ObjectId> {
    private static final Logger logger = LoggerFactory.getLogger(GridFsBlobStore.class);

    private final GridFSBucket bucket;

    public GridFsBlobStore(GridFSBucket bucket) {
        this.bucket = bucket;
    }

    @Override
    public ObjectId upload(String name, byte[] bytes) {
        ObjectId id = bucket.uploadFromStream(name, new ByteArrayInputStream(bytes));
        logger.debug("Uploaded {} ({} bytes) as {}", name, bytes.length, id);
        return id;
    }

    @Override
    public byte[] download(ObjectId id) {
        requireExists(id);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            bucket.downloadToStream(id, out);
        } catch (MongoGridFSException e) {
            throw new NotFoundException("File not found", e);
        }
        return out.toByteArray();
    }

    @Override
    public void delete(ObjectId id) {
        requireExists(id);
        try {
            bucket.delete(id);
        } catch (MongoGridFSException e) {
            throw new NotFoundException("File not found", e);
        }
    }

    private void requireExists(ObjectId id) {
        if (bucket.find(Filters.eq("_id", id)).first() == null) {
            throw new NotFoundException("File not found");
        }
    }
}
