package com.pmr.collab.dto;

import java.util.List;

/**
 * Kind-specific {@code data} body of an event envelope.
 */
public interface WirePayload {

    /**
     * Rejects a payload that is missing fields its event kind requires.
     *
     * @throws IllegalArgumentException naming the first missing field
     */
    default void validate() {
    }

    static void require(Object value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
    }

    static void requireEach(List<?> values, String field) {
        require(values, field);
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new IllegalArgumentException("Null entry " + i + " in " + field);
            }
        }
    }
}
