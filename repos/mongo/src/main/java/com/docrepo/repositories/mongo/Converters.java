package com.docrepo.repositories.mongo;

import com.docrepo.core.Filter;
import com.docrepo.core.errors.BadRequestException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Translation between Java objects and BSON documents.
 *
 * A record's {@code id} is stored as {@code _id}, at the top level and in every
 * embedded record, so that array elements can be addressed by {@code field._id}.
 */
public interface Converters {
    ObjectMapper MAPPER = BsonModule.objectMapper();
    TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};
    String ID = "id";
    String STORED_ID = "_id";

    static Document toDocument(Object value) {
        return mapToDocument(MAPPER.convertValue(value, FIELDS));
    }

    static <T> T fromDocument(Map<String, Object> doc, Class<T> type) {
        if (doc == null) {
            return null;
        }
        return MAPPER.convertValue(fromBsonValue(doc), type);
    }

    /**
     * Parses any stored value, record or scalar, as {@code type}.
     */
    static <T> T fromBson(Object value, Class<T> type) {
        return MAPPER.convertValue(fromBsonValue(value), type);
    }

    static Document toQuery(Filter filter) {
        Document query = new Document();
        if (filter != null) {
            filter.asMap().forEach((key, value) -> query.put(ID.equals(key) ? STORED_ID : key, toBsonValue(value)));
        }
        return query;
    }

    /**
     * Converts a Java value to something the driver's default codecs can
     * encode: maps become documents with {@code id} renamed, lists are converted
     * element-wise, BSON scalars pass through and anything else goes through Jackson.
     * A {@code BigInteger} becomes a {@code Long}; one past 64 bits is a {@link BadRequestException}.
     */
    @SuppressWarnings("unchecked")
    static Object toBsonValue(Object value) {
        if (value instanceof BigInteger) {
            BigInteger integer = (BigInteger) value;
            if (integer.bitLength() > 63) {
                throw new BadRequestException("Integer out of 64-bit range: " + integer);
            }
            return integer.longValue();
        }
        if (value == null || isBsonScalar(value)) {
            return value;
        }
        if (value instanceof Map) {
            return mapToDocument((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(toBsonValue(element));
            }
            return converted;
        }
        return toBsonValue(MAPPER.convertValue(value, Object.class));
    }

    @SuppressWarnings("unchecked")
    private static Object fromBsonValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((key, field) ->
                    fields.put(STORED_ID.equals(key) ? ID : key, fromBsonValue(field)));
            return fields;
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(fromBsonValue(element));
            }
            return converted;
        }
        return value;
    }

    private static Document mapToDocument(Map<String, Object> fields) {
        Document doc = new Document();
        fields.forEach((key, value) -> doc.put(ID.equals(key) ? STORED_ID : key, toBsonValue(value)));
        return doc;
    }

    private static boolean isBsonScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof ObjectId || value instanceof Date || value instanceof UUID
                || value instanceof byte[];
    }
}
