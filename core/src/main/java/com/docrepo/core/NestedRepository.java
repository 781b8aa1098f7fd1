package com.docrepo.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD on the elements of an array field embedded in a parent record. The
 * elements have no storage of their own; every operation is a mutation or
 * projection of the parent document, scoped by parent id.
 *
 * Record elements are addressed by their own id, unique within the parent's array.
 *
 * @param <ID> identity type shared by parents and their record elements
 */
public interface NestedRepository<ID> {

    /**
     * Elements of {@code field}, optionally sorted by element fields and capped
     * at {@code limit}. Empty when the parent is missing or the array is empty.
     */
    <E> List<E> nestedList(ID parentId, String field, Class<E> type, List<SortKey> sort, Integer limit);

    long nestedCount(ID parentId, String field);

    /**
     * Appends {@code value} to {@code field} and returns it parsed as {@code type}.
     * Empty when the parent does not exist.
     */
    <E> Optional<E> nestedCreate(ID parentId, String field, NestedValue value, Class<E> type);

    /**
     * Element with {@code nestedId}, or the first element when {@code nestedId}
     * is null. {@code filter} adds constraints on the parent.
     */
    <E> Optional<E> nestedGet(ID parentId, ID nestedId, Filter filter, String field, Class<E> type);

    /**
     * Sets {@code updates} on the first element with {@code nestedId} only,
     * leaving its siblings untouched, and returns the element after the write.
     * Empty when nothing matched, unless {@code upsert} is set: then a missing
     * element is appended to the matching parent with {@code nestedId} as its id.
     * {@code nestedId} is required.
     */
    <E> Optional<E> nestedUpdate(ID parentId, ID nestedId, String field, Map<String, Object> updates,
                                 Class<E> type, Filter filter, boolean upsert);

    /**
     * Pulls the element with {@code nestedId}, which is required.
     *
     * @return whether an element was removed
     */
    boolean nestedRemove(ID parentId, ID nestedId, Filter filter, String field);
}
