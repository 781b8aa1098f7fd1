package com.docrepo.core;

import com.docrepo.core.errors.BadRequestException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A raw value appended to an embedded array. Only three shapes are accepted:
 * a scalar (string or integral number), a mapping (string-keyed map) and a
 * sequence. Everything else is rejected at construction.
 */
public sealed interface NestedValue permits NestedValue.Scalar, NestedValue.Mapping, NestedValue.Sequence {

    /**
     * The value as it should be written to the store.
     */
    Object raw();

    /**
     * A string or an integer. A {@code BigInteger} is narrowed to {@code Long}
     * and rejected when it does not fit.
     */
    record Scalar(Object raw) implements NestedValue {
        public Scalar {
            if (!(raw instanceof String) && !isIntegral(raw)) {
                throw new BadRequestException("Scalar nested value must be a string or an integer");
            }
            if (raw instanceof BigInteger) {
                raw = narrow((BigInteger) raw);
            }
        }
    }

    record Mapping(Map<String, Object> raw) implements NestedValue {
        public Mapping {
            raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        }
    }

    record Sequence(List<Object> raw) implements NestedValue {
        public Sequence {
            raw = Collections.unmodifiableList(new ArrayList<>(raw));
        }
    }

    static NestedValue scalar(String value) {
        return new Scalar(value);
    }

    static NestedValue scalar(long value) {
        return new Scalar(value);
    }

    static NestedValue record(Map<String, ?> value) {
        return of(value);
    }

    /**
     * Classifies an arbitrary value, throwing {@link BadRequestException} for
     * anything that is not a string, integer, map with string keys or list.
     */
    @SuppressWarnings("unchecked")
    static NestedValue of(Object value) {
        if (value == null) {
            throw new BadRequestException("Nested value must not be null");
        }
        if (value instanceof NestedValue) {
            return (NestedValue) value;
        }
        if (value instanceof String || isIntegral(value)) {
            return new Scalar(value);
        }
        if (value instanceof Map) {
            for (Object key : ((Map<?, ?>) value).keySet()) {
                if (!(key instanceof String)) {
                    throw new BadRequestException("Nested record keys must be strings, got " + key);
                }
            }
            return new Mapping((Map<String, Object>) value);
        }
        if (value instanceof List) {
            return new Sequence((List<Object>) value);
        }
        throw new BadRequestException(
                "Data must be a record, a sequence, a string or an integer, got " + value.getClass().getSimpleName());
    }

    private static Long narrow(BigInteger value) {
        if (value.bitLength() > 63) {
            throw new BadRequestException("Integer nested value out of 64-bit range: " + value);
        }
        return value.longValue();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }
}
