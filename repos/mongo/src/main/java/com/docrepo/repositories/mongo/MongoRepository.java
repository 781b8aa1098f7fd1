package com.docrepo.repositories.mongo;

import com.docrepo.core.Entity;
import com.docrepo.core.Filter;
import com.docrepo.core.Listing;
import com.docrepo.core.NestedRepository;
import com.docrepo.core.NestedValue;
import com.docrepo.core.Repository;
import com.docrepo.core.SortKey;
import com.docrepo.core.errors.UnconfirmedWriteException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.docrepo.repositories.mongo.Converters.STORED_ID;
import static com.docrepo.repositories.mongo.Converters.fromBson;
import static com.docrepo.repositories.mongo.Converters.fromDocument;
import static com.docrepo.repositories.mongo.Converters.toBsonValue;
import static com.docrepo.repositories.mongo.Converters.toDocument;
import static com.docrepo.repositories.mongo.Converters.toQuery;
import static com.mongodb.client.model.Filters.eq;

/**
 * Repository over one MongoDB collection.
 *
 * Concrete repositories bind the entity class, the collection and the identity
 * strategy:
 *
 * <pre>
 * public class NoteRepository extends MongoRepository&lt;Note, ObjectId&gt; {
 *     public NoteRepository(MongoStore store) {
 *         super(store, "notes", Note.class, Identities.objectIds());
 *     }
 * }
 * </pre>
 *
 * Every operation is a single-document round trip or a short sequence of them.
 * Single-document writes are atomic in the store; sequences (write, then read
 * back) are not.
 */
public class MongoRepository<T extends Entity<ID>, ID> implements Repository<T, ID>, NestedRepository<ID> {
    private static final Logger logger = LoggerFactory.getLogger(MongoRepository.class);
    private static final String CREATED_AT = "createdAt";
    private static final String UPDATED_AT = "updatedAt";
    private static final String COUNT = "count";
    private static final String ITEMS = "items";
    private static final Set<String> IMMUTABLE_FIELDS = Set.of(Converters.ID, STORED_ID, CREATED_AT);

    private final MongoCollection<Document> collection;
    private final Class<T> type;
    private final Supplier<ID> ids;
    private final boolean legacyPageSkip;

    public MongoRepository(MongoStore store, String collectionName, Class<T> type, Supplier<ID> ids) {
        this(store.collection(collectionName), type, ids, store.config().legacyPageSkip);
    }

    /**
     * @param collection     collection holding the records
     * @param type           entity class records are parsed into
     * @param ids            identity strategy for records created without one
     * @param legacyPageSkip see {@link MongoConfig#legacyPageSkip}
     */
    public MongoRepository(MongoCollection<Document> collection, Class<T> type, Supplier<ID> ids, boolean legacyPageSkip) {
        this.collection = collection;
        this.type = type;
        this.ids = ids;
        this.legacyPageSkip = legacyPageSkip;
    }

    public MongoCollection<Document> collection() {
        return collection;
    }

    @Override
    public Listing<T> list(Integer size, Integer page, Filter filter) {
        Document query = toQuery(filter);
        long totalCount = collection.countDocuments(query);

        FindIterable<Document> results = collection.find(query);
        if (size != null && page != null) {
            if (size < 1) {
                return new Listing<>(totalCount, List.of());
            }
            long skip = skipFor(size, page);
            if (skip > Integer.MAX_VALUE) {
                // the store takes an int skip; no collection holds that many records
                return new Listing<>(totalCount, List.of());
            }
            results = results.skip((int) skip).limit(size);
        }

        List<T> items = results.into(new ArrayList<>()).stream()
                .map(doc -> fromDocument(doc, type))
                .collect(Collectors.toList());
        return new Listing<>(totalCount, items);
    }

    @Override
    public Optional<T> get(ID id) {
        return Optional.ofNullable(collection.find(eq(STORED_ID, id)).first())
                .map(doc -> fromDocument(doc, type));
    }

    @Override
    public Optional<T> searchOne(Filter filter) {
        return Optional.ofNullable(collection.find(toQuery(filter)).first())
                .map(doc -> fromDocument(doc, type));
    }

    @Override
    public Optional<List<T>> searchMany(Filter filter) {
        List<T> found = collection.find(toQuery(filter)).into(new ArrayList<>()).stream()
                .map(doc -> fromDocument(doc, type))
                .collect(Collectors.toList());
        return found.isEmpty() ? Optional.empty() : Optional.of(found);
    }

    @Override
    public long count(Filter filter) {
        return collection.countDocuments(toQuery(filter));
    }

    @Override
    public T create(T entity) {
        ID id = entity.getId() != null ? entity.getId() : ids.get();
        Document doc = toDocument(entity);
        doc.put(STORED_ID, toBsonValue(id));
        if (doc.get(CREATED_AT) == null) {
            doc.put(CREATED_AT, now());
        }

        try {
            collection.insertOne(doc);
        } catch (Exception e) {
            logger.error("Error creating document in {}: {}", collection.getNamespace(), e.getMessage(), e);
            throw e;
        }

        return get(id).orElseThrow(() -> {
            logger.error("Created document {} in {} could not be read back", id, collection.getNamespace());
            return new UnconfirmedWriteException(id);
        });
    }

    @Override
    public Optional<T> update(ID id, T entity) {
        Document fields = toDocument(entity);
        fields.remove(STORED_ID);
        fields.remove(CREATED_AT);
        fields.put(UPDATED_AT, now());

        UpdateResult result;
        try {
            result = collection.updateOne(eq(STORED_ID, id), new Document("$set", fields));
        } catch (Exception e) {
            logger.error("Error updating document {} in {}: {}", id, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }

        if (result.getMatchedCount() == 0) {
            return Optional.empty();
        }
        return get(id);
    }

    @Override
    public boolean delete(ID id) {
        try {
            return collection.deleteOne(eq(STORED_ID, id)).getDeletedCount() == 1;
        } catch (Exception e) {
            logger.error("Error deleting document {} in {}: {}", id, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Unwinds {@code field}, sorts and caps the elements, then groups them back.
     * Sort fields are relative to the element; an empty sort field orders scalar
     * elements by value.
     */
    @Override
    public <E> List<E> nestedList(ID parentId, String field, Class<E> elementType, List<SortKey> sort, Integer limit) {
        List<Bson> pipeline = new ArrayList<>();
        pipeline.add(Aggregates.match(eq(STORED_ID, parentId)));
        pipeline.add(Aggregates.unwind("$" + field));
        if (sort != null && !sort.isEmpty()) {
            Document order = new Document();
            for (SortKey key : sort) {
                String path = key.field().isEmpty() ? field : field + "." + key.field();
                order.append(path, key.direction().value());
            }
            pipeline.add(Aggregates.sort(order));
        }
        if (limit != null && limit > 0) {
            pipeline.add(Aggregates.limit(limit));
        }
        pipeline.add(Aggregates.group("$" + STORED_ID,
                Accumulators.sum(COUNT, 1),
                Accumulators.push(ITEMS, "$" + field)));

        logger.debug("nestedList pipeline on {}: {}", collection.getNamespace(), pipeline);

        Document result = collection.aggregate(pipeline).first();
        if (result == null) {
            return List.of();
        }
        List<?> elements = result.get(ITEMS, List.class);
        return elements.stream()
                .map(element -> fromBson(element, elementType))
                .collect(Collectors.toList());
    }

    @Override
    public long nestedCount(ID parentId, String field) {
        List<Bson> pipeline = List.of(
                Aggregates.match(eq(STORED_ID, parentId)),
                Aggregates.unwind("$" + field),
                Aggregates.group("$" + STORED_ID, Accumulators.sum(COUNT, 1)));

        Document result = collection.aggregate(pipeline).first();
        if (result == null) {
            return 0;
        }
        return result.get(COUNT, Number.class).longValue();
    }

    @Override
    public <E> Optional<E> nestedCreate(ID parentId, String field, NestedValue value, Class<E> elementType) {
        Object stored = toBsonValue(value.raw());
        if (stored instanceof Document && Entity.class.isAssignableFrom(elementType)) {
            Document element = (Document) stored;
            if (element.get(STORED_ID) == null) {
                element.put(STORED_ID, toBsonValue(ids.get()));
            }
            if (element.get(CREATED_AT) == null) {
                element.put(CREATED_AT, now());
            }
        }

        UpdateResult result;
        try {
            result = collection.updateOne(eq(STORED_ID, parentId), Updates.push(field, stored));
        } catch (Exception e) {
            logger.error("Error appending to {} of {} in {}: {}", field, parentId, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }

        if (result.getMatchedCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(fromBson(stored, elementType));
    }

    @Override
    public <E> Optional<E> nestedGet(ID parentId, ID nestedId, Filter filter, String field, Class<E> elementType) {
        Document query = elementQuery(parentId, nestedId, filter, field);
        Document parent = collection.find(query).projection(elementProjection(field, nestedId)).first();
        if (parent == null) {
            return Optional.empty();
        }
        return findElement(parent, field, nestedId).map(element -> fromBson(element, elementType));
    }

    /**
     * Sets {@code updates} on the first element of {@code field} whose id is
     * {@code nestedId} through the positional operator. Identity and creation
     * time of the element are never rewritten. With {@code upsert}, a missing
     * element is appended to the matching parent instead; a missing parent is
     * never created.
     */
    @Override
    public <E> Optional<E> nestedUpdate(ID parentId, ID nestedId, String field, Map<String, Object> updates,
                                        Class<E> elementType, Filter filter, boolean upsert) {
        Objects.requireNonNull(nestedId, "nestedId");
        Document query = elementQuery(parentId, nestedId, filter, field);

        Document set = new Document();
        updates.forEach((key, value) -> {
            if (IMMUTABLE_FIELDS.contains(key)) {
                logger.debug("Ignoring update of immutable element field {}", key);
            } else {
                set.put(field + ".$." + key, toBsonValue(value));
            }
        });
        if (Entity.class.isAssignableFrom(elementType) && !updates.containsKey(UPDATED_AT)) {
            set.put(field + ".$." + UPDATED_AT, now());
        }

        Optional<E> updated = set.isEmpty()
                ? nestedGet(parentId, nestedId, filter, field, elementType)
                : setElement(query, set, parentId, nestedId, field, elementType);
        if (updated.isPresent() || !upsert) {
            return updated;
        }
        return appendElement(parentId, nestedId, field, updates, elementType, filter);
    }

    @Override
    public boolean nestedRemove(ID parentId, ID nestedId, Filter filter, String field) {
        Objects.requireNonNull(nestedId, "nestedId");
        Document query = elementQuery(parentId, nestedId, filter, field);
        try {
            UpdateResult result = collection.updateOne(query, Updates.pull(field, new Document(STORED_ID, nestedId)));
            return result.getModifiedCount() > 0;
        } catch (Exception e) {
            logger.error("Error removing {}.{} of {} in {}: {}", field, nestedId, parentId, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }
    }

    private <E> Optional<E> setElement(Document query, Document set, ID parentId, ID nestedId,
                                       String field, Class<E> elementType) {
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions()
                .returnDocument(ReturnDocument.AFTER)
                .projection(elementProjection(field, nestedId));

        Document updated;
        try {
            updated = collection.findOneAndUpdate(query, new Document("$set", set), options);
        } catch (Exception e) {
            logger.error("Error updating {}.{} of {} in {}: {}", field, nestedId, parentId, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }

        if (updated == null) {
            return Optional.empty();
        }
        return findElement(updated, field, nestedId).map(element -> fromBson(element, elementType));
    }

    /**
     * Pushes {@code {_id: nestedId, ...updates}} onto a parent that does not hold
     * the element yet. A concurrent writer that appended it first wins; the
     * element is read back either way.
     */
    private <E> Optional<E> appendElement(ID parentId, ID nestedId, String field, Map<String, Object> updates,
                                          Class<E> elementType, Filter filter) {
        Document element = new Document(STORED_ID, toBsonValue(nestedId));
        updates.forEach((key, value) -> {
            if (!IMMUTABLE_FIELDS.contains(key)) {
                element.put(key, toBsonValue(value));
            }
        });
        if (Entity.class.isAssignableFrom(elementType)) {
            element.put(CREATED_AT, now());
        }

        Document query = toQuery(filter);
        query.put(STORED_ID, parentId);
        query.put(field + "." + STORED_ID, new Document("$ne", nestedId));

        UpdateResult result;
        try {
            result = collection.updateOne(query, Updates.push(field, element));
        } catch (Exception e) {
            logger.error("Error upserting {}.{} of {} in {}: {}", field, nestedId, parentId, collection.getNamespace(), e.getMessage(), e);
            throw e;
        }
        logger.debug("Upsert of {}.{} on {} matched {} parent(s)", field, nestedId, parentId, result.getMatchedCount());

        return nestedGet(parentId, nestedId, filter, field, elementType);
    }

    private long skipFor(int size, int page) {
        if (page <= 1) {
            return 0;
        }
        return legacyPageSkip ? (long) size * page : (long) size * (page - 1);
    }

    private Document elementQuery(ID parentId, ID nestedId, Filter filter, String field) {
        Document query = toQuery(filter);
        query.put(STORED_ID, parentId);
        if (nestedId != null) {
            query.put(field + "." + STORED_ID, nestedId);
        }
        return query;
    }

    private Bson elementProjection(String field, ID nestedId) {
        return nestedId != null
                ? Projections.elemMatch(field, eq(STORED_ID, nestedId))
                : Projections.include(field);
    }

    private Optional<Object> findElement(Document parent, String field, ID nestedId) {
        Object array = parent.get(field);
        if (!(array instanceof List)) {
            return Optional.empty();
        }
        for (Object element : (List<?>) array) {
            if (nestedId == null) {
                return Optional.ofNullable(element);
            }
            if (element instanceof Document && Objects.equals(((Document) element).get(STORED_ID), nestedId)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private static Date now() {
        return Date.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }
}
