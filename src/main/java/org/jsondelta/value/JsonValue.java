package org.jsondelta.value;

import java.util.Optional;

/**
 * Immutable node of a parsed document.
 *
 * <p>Every implementation reports exactly one {@link Kind}. Walks over a document switch on
 * {@link #kind()} in a switch expression so that a new kind fails compilation at every walk.
 */
public interface JsonValue {
    enum Kind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        OBJECT,
        ARRAY;

        public boolean isContainer() {
            return this == OBJECT || this == ARRAY;
        }
    }

    Kind kind();

    default boolean isScalar() {
        return !kind().isContainer();
    }

    /**
     * Looks up a field of an object node. Non-object nodes have no fields.
     */
    default Optional<JsonValue> field(String name) {
        return Optional.empty();
    }

    /**
     * Looks up an element of an array node. Non-array nodes have no elements.
     */
    default Optional<JsonValue> element(int index) {
        return Optional.empty();
    }
}
