package com.opsdash.pagination.keyset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed ordering-key values of the row a cursor points at.
 */
public record CursorPosition(Map<String, Object> values) {

    public CursorPosition {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object value(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("Cursor position has no value for '" + field + "'");
        }
        return values.get(field);
    }
}
