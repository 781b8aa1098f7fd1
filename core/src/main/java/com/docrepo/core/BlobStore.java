package com.docrepo.core;

/**
 * Named binary content kept next to the documents.
 *
 * @param <ID> file identity type
 */
public interface BlobStore<ID> {
    ID upload(String name, byte[] bytes);

    /**
     * @throws com.docrepo.core.errors.NotFoundException when no file has that id
     */
    byte[] download(ID id);

    /**
     * @throws com.docrepo.core.errors.NotFoundException when no file has that id
     */
    void delete(ID id);
}
