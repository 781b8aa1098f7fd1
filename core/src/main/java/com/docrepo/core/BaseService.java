package com.docrepo.core;

import com.docrepo.core.errors.BadRequestException;
import com.docrepo.core.errors.NotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business layer over one {@link Repository}.
 *
 * Translates request models into stored entities and stored entities into
 * response models, enforces the declared unique field set and turns absence
 * into {@link NotFoundException}. The uniqueness check is a read before the
 * write; pair it with a unique index when concurrent writers must never race
 * past it.
 *
 * @param <I>  request model
 * @param <O>  response model
 * @param <T>  stored entity
 * @param <ID> identity type
 */
public class BaseService<I, O, T extends Entity<ID>, ID> {
    private static final Logger logger = LoggerFactory.getLogger(BaseService.class);
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};
    private static final Set<String> MANAGED_FIELDS = Set.of("id", "createdAt", "updatedAt");

    protected final Repository<T, ID> repository;
    private final Class<T> entityType;
    private final Class<O> outputType;
    private final List<String> uniqueFields;
    private final ObjectMapper mapper;

    /**
     * @param repository   storage for the entity
     * @param entityType   stored entity class
     * @param outputType   response model class
     * @param uniqueFields fields whose combined values may not repeat across records
     * @param mapper       mapper that understands the store's identity and time types
     */
    public BaseService(Repository<T, ID> repository,
                       Class<T> entityType,
                       Class<O> outputType,
                       List<String> uniqueFields,
                       ObjectMapper mapper) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
        this.uniqueFields = uniqueFields != null ? List.copyOf(uniqueFields) : List.of();
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Listing<O> list(Integer size, Integer page, Filter filter) {
        if ((size != null && size < 1) || (page != null && page < 1)) {
            throw new BadRequestException("size and page must be positive");
        }
        return repository.list(size, page, filter).map(this::toOutput);
    }

    public Page<O> paginate(int size, int page, Filter filter) {
        return Page.of(list(size, page, filter), page, size);
    }

    public O get(ID id) {
        return repository.get(id)
                .map(this::toOutput)
                .orElseThrow(() -> new NotFoundException("Object with id " + id + " does not exist"));
    }

    public O searchOne(Filter filter) {
        return repository.searchOne(filter)
                .map(this::toOutput)
                .orElseThrow(() -> new NotFoundException("Objects matching filters not found"));
    }

    public List<O> searchMany(Filter filter) {
        return repository.searchMany(filter)
                .map(found -> found.stream().map(this::toOutput).collect(Collectors.toList()))
                .orElseThrow(() -> new NotFoundException("Objects matching filters not found"));
    }

    public long count(Filter filter) {
        return repository.count(filter);
    }

    public O create(I input) {
        T candidate = toEntity(input);
        Filter unique = uniqueFilter(candidate);
        if (!unique.isEmpty() && repository.searchOne(unique).isPresent()) {
            logger.debug("Rejected create of {}: {} already taken", entityType.getSimpleName(), unique);
            throw new BadRequestException("Cannot create data containing already existing unique properties");
        }
        return toOutput(repository.create(candidate));
    }

    /**
     * Applies the fields set on {@code input} over the stored record. Identity and
     * timestamps are never taken from the input.
     */
    public O update(ID id, I input) {
        T existing = repository.get(id)
                .orElseThrow(() -> new NotFoundException("Object with id " + id + " is not found"));

        Map<String, Object> patch = patchOf(input);
        T merged = merge(existing, patch);

        if (uniqueFields.stream().anyMatch(patch::containsKey)) {
            Filter unique = uniqueFilter(merged);
            if (!unique.isEmpty()) {
                boolean takenElsewhere = repository.searchMany(unique)
                        .map(found -> found.stream().anyMatch(other -> !Objects.equals(other.getId(), id)))
                        .orElse(false);
                if (takenElsewhere) {
                    logger.debug("Rejected update of {} {}: {} already taken", entityType.getSimpleName(), id, unique);
                    throw new BadRequestException("Cannot update data due to existing unique properties");
                }
            }
        }

        return repository.update(id, merged)
                .map(this::toOutput)
                .orElseThrow(() -> new NotFoundException("Object with id " + id + " is not found"));
    }

    public void delete(ID id) {
        if (!repository.delete(id)) {
            throw new NotFoundException("Object with id " + id + " is not found");
        }
    }

    protected T toEntity(I input) {
        T entity = mapper.convertValue(input, entityType);
        entity.setId(null);
        entity.setCreatedAt(null);
        entity.setUpdatedAt(null);
        return entity;
    }

    protected O toOutput(T entity) {
        return mapper.convertValue(entity, outputType);
    }

    private Map<String, Object> patchOf(I input) {
        Map<String, Object> fields = mapper.convertValue(input, FIELDS);
        Map<String, Object> patch = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value != null && !MANAGED_FIELDS.contains(key)) {
                patch.put(key, value);
            }
        });
        return patch;
    }

    private T merge(T existing, Map<String, Object> patch) {
        try {
            return mapper.updateValue(existing, patch);
        } catch (JsonMappingException e) {
            throw new BadRequestException("Cannot apply update: " + e.getOriginalMessage(), e);
        }
    }

    private Filter uniqueFilter(T entity) {
        if (uniqueFields.isEmpty()) {
            return Filter.empty();
        }
        Map<String, Object> fields = mapper.convertValue(entity, FIELDS);
        Map<String, Object> criteria = new LinkedHashMap<>();
        for (String field : uniqueFields) {
            Object value = fields.get(field);
            if (value != null) {
                criteria.put(field, value);
            }
        }
        return Filter.of(criteria);
    }
}
