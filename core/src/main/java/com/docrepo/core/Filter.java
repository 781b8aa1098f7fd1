package com.docrepo.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exact-match conjunction of field/value pairs. Keys may use dotted paths into
 * sub-documents. Immutable; {@link #and(String, Object)} returns a copy.
 */
public final class Filter {
    private static final Filter EMPTY = new Filter(Collections.emptyMap());

    private final Map<String, Object> criteria;

    private Filter(Map<String, Object> criteria) {
        this.criteria = criteria;
    }

    public static Filter empty() {
        return EMPTY;
    }

    public static Filter where(String field, Object value) {
        return EMPTY.and(field, value);
    }

    public static Filter of(Map<String, ?> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return EMPTY;
        }
        return new Filter(Collections.unmodifiableMap(new LinkedHashMap<>(criteria)));
    }

    public Filter and(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> copy = new LinkedHashMap<>(criteria);
        copy.put(field, value);
        return new Filter(Collections.unmodifiableMap(copy));
    }

    public Filter and(Filter other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(criteria);
        copy.putAll(other.criteria);
        return new Filter(Collections.unmodifiableMap(copy));
    }

    public Map<String, Object> asMap() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Filter)) return false;
        return criteria.equals(((Filter) o).criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "Filter" + criteria;
    }
}
