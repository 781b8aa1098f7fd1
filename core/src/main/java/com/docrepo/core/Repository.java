package com.docrepo.core;

import java.util.List;
import java.util.Optional;

/**
 * Typed CRUD over one collection.
 *
 * Implementations never raise domain errors: a missing record is an empty
 * {@link Optional}, {@code false} or {@code 0}. Storage failures propagate as the
 * driver's own unchecked exceptions.
 *
 * @param <T>  stored entity type
 * @param <ID> identity type
 */
public interface Repository<T extends Entity<ID>, ID> {

    /**
     * Lists records matching {@code filter}. A window is applied only when both
     * {@code size} and {@code page} are given; {@code page} is 1-based. The total
     * count always covers the full filter.
     */
    Listing<T> list(Integer size, Integer page, Filter filter);

    Optional<T> get(ID id);

    /**
     * First record matching the filter.
     */
    Optional<T> searchOne(Filter filter);

    /**
     * All records matching the filter, or empty when there are none. A present
     * result is never an empty list.
     */
    Optional<List<T>> searchMany(Filter filter);

    long count(Filter filter);

    /**
     * Inserts the entity and returns the stored record as read back.
     */
    T create(T entity);

    /**
     * Replaces every field except identity and creation time, then returns the
     * record as read back. Empty when no record has that id.
     */
    Optional<T> update(ID id, T entity);

    /**
     * @return true iff exactly one record was removed
     */
    boolean delete(ID id);
}
