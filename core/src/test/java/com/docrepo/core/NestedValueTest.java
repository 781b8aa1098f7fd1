package com.docrepo.core;

import com.docrepo.core.errors.BadRequestException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NestedValueTest {

    @Test
    void ofShouldClassifyTheAcceptedShapes() {
        assertInstanceOf(NestedValue.Scalar.class, NestedValue.of("tag"));
        assertInstanceOf(NestedValue.Scalar.class, NestedValue.of(42));
        assertInstanceOf(NestedValue.Scalar.class, NestedValue.of(42L));
        assertInstanceOf(NestedValue.Mapping.class, NestedValue.of(Map.of("text", "hi")));
        assertInstanceOf(NestedValue.Sequence.class, NestedValue.of(List.of(1, 2)));
    }

    @Test
    void ofShouldRejectEverythingElse() {
        assertThrows(BadRequestException.class, () -> NestedValue.of(null));
        assertThrows(BadRequestException.class, () -> NestedValue.of(1.5));
        assertThrows(BadRequestException.class, () -> NestedValue.of(true));
        assertThrows(BadRequestException.class, () -> NestedValue.of(new Object()));
        assertThrows(BadRequestException.class, () -> NestedValue.of(Map.of(1, "numeric key")));
    }

    @Test
    void bigIntegersShouldNarrowToLongOrBeRejected() {
        assertEquals(5L, NestedValue.of(new BigInteger("5")).raw());
        assertEquals(Long.MIN_VALUE, NestedValue.of(BigInteger.valueOf(Long.MIN_VALUE)).raw());
        assertThrows(BadRequestException.class,
                () -> NestedValue.of(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)));
    }

    @Test
    void mappingShouldCopyItsSource() {
        Map<String, Object> source = new HashMap<>();
        source.put("text", "before");

        NestedValue value = NestedValue.record(source);
        source.put("text", "after");

        assertEquals(Map.of("text", "before"), value.raw());
    }
}
