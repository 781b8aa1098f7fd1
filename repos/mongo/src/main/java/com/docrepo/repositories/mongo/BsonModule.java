package com.docrepo.repositories.mongo;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.types.ObjectId;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Jackson support for the BSON value types a document carries.
 *
 * When Jackson converts between objects in memory ({@code convertValue},
 * {@code updateValue}) ObjectIds and dates pass through untouched as embedded
 * objects, so a stored document keeps its native types. When writing JSON they
 * become a hex string and an ISO-8601 instant.
 */
public class BsonModule extends SimpleModule {

    public BsonModule() {
        super("BsonModule");
        addSerializer(ObjectId.class, new ObjectIdSerializer());
        addDeserializer(ObjectId.class, new ObjectIdDeserializer());
        addSerializer(Instant.class, new InstantSerializer());
        addDeserializer(Instant.class, new InstantDeserializer());
        addSerializer(Date.class, new DateSerializer());
    }

    /**
     * Mapper used for documents and for service-level model translation.
     */
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        // registered last so it wins over the java.time defaults for Instant
        mapper.registerModule(new BsonModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    static class ObjectIdSerializer extends StdSerializer<ObjectId> {
        ObjectIdSerializer() {
            super(ObjectId.class);
        }

        @Override
        public void serialize(ObjectId value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (gen instanceof TokenBuffer) {
                gen.writeEmbeddedObject(value);
            } else {
                gen.writeString(value.toHexString());
            }
        }
    }

    static class ObjectIdDeserializer extends StdDeserializer<ObjectId> {
        ObjectIdDeserializer() {
            super(ObjectId.class);
        }

        @Override
        public ObjectId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_EMBEDDED_OBJECT) {
                Object embedded = p.getEmbeddedObject();
                if (embedded instanceof ObjectId) {
                    return (ObjectId) embedded;
                }
                return embedded == null ? null : parse(embedded.toString(), ctxt);
            }
            if (token == JsonToken.VALUE_STRING) {
                return parse(p.getText(), ctxt);
            }
            return (ObjectId) ctxt.handleUnexpectedToken(ObjectId.class, p);
        }

        private ObjectId parse(String text, DeserializationContext ctxt) throws IOException {
            if (!ObjectId.isValid(text)) {
                throw ctxt.weirdStringException(text, ObjectId.class, "not a valid ObjectId");
            }
            return new ObjectId(text);
        }
    }

    static class InstantSerializer extends StdSerializer<Instant> {
        InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (gen instanceof TokenBuffer) {
                gen.writeEmbeddedObject(Date.from(value));
            } else {
                gen.writeString(value.toString());
            }
        }
    }

    static class DateSerializer extends StdSerializer<Date> {
        DateSerializer() {
            super(Date.class);
        }

        @Override
        public void serialize(Date value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (gen instanceof TokenBuffer) {
                gen.writeEmbeddedObject(value);
            } else {
                gen.writeString(value.toInstant().toString());
            }
        }
    }

    static class InstantDeserializer extends StdDeserializer<Instant> {
        InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_EMBEDDED_OBJECT) {
                Object embedded = p.getEmbeddedObject();
                if (embedded instanceof Date) {
                    return ((Date) embedded).toInstant();
                }
                if (embedded instanceof Instant) {
                    return (Instant) embedded;
                }
                return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
            }
            if (token == JsonToken.VALUE_STRING) {
                try {
                    return Instant.parse(p.getText());
                } catch (DateTimeParseException e) {
                    throw ctxt.weirdStringException(p.getText(), Instant.class, e.getMessage());
                }
            }
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return Instant.ofEpochMilli(p.getLongValue());
            }
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
        }
    }
}
