package com.docrepo.core;

import java.util.Objects;

/**
 * Sort order on one field of a nested element. The field is relative to the
 * element, not to the parent document.
 */
public record SortKey(String field, Direction direction) {

    public enum Direction {
        ASCENDING(1),
        DESCENDING(-1);

        private final int value;

        Direction(int value) {
            this.value = value;
        }

        public int value() {
            return value;
        }
    }

    public SortKey {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortKey asc(String field) {
        return new SortKey(field, Direction.ASCENDING);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, Direction.DESCENDING);
    }
}
