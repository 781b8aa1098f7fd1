package com.docrepo.repositories.mongo;

import com.docrepo.core.errors.NotFoundException;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GridFsBlobStoreTest {
    private GridFsBlobStore blobs;

    @BeforeEach
    void setUp() {
        blobs = InMemoryMongo.store().blobs("files_" + UUID.randomUUID().toString().replace("-", ""));
    }

    @Test
    void uploadedBytesShouldDownloadUnchanged() {
        byte[] content = "hello blob".getBytes(StandardCharsets.UTF_8);

        ObjectId id = blobs.upload("hello.txt", content);

        assertArrayEquals(content, blobs.download(id));
    }

    @Test
    void deleteShouldRemoveTheFile() {
        ObjectId id = blobs.upload("gone.txt", new byte[]{1, 2, 3});

        blobs.delete(id);

        assertThrows(NotFoundException.class, () -> blobs.download(id));
        assertThrows(NotFoundException.class, () -> blobs.delete(id));
    }

    @Test
    void unknownIdsShouldFailWithNotFound() {
        NotFoundException error = assertThrows(NotFoundException.class, () -> blobs.download(new ObjectId()));

        assertEquals(404, error.status());
    }
}
