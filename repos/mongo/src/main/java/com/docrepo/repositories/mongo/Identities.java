package com.docrepo.repositories.mongo;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedGenerator;
import org.bson.types.ObjectId;

import java.util.function.Supplier;

/**
 * Identity strategies for records created without an id.
 */
public final class Identities {

    private Identities() {
    }

    public static Supplier<ObjectId> objectIds() {
        return ObjectId::new;
    }

    public static Supplier<String> timeBasedUuids() {
        TimeBasedGenerator generator = Generators.timeBasedGenerator();
        return () -> generator.generate().toString();
    }
}
