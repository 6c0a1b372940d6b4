package com.opsdash.pagination.cursor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decrypted content of a cursor token: the ordering-key values of one edge row.
 * Values are JSON scalars only (String, Long, BigDecimal, Boolean or null).
 */
public record CursorPayload(String version, Map<String, Object> fields, long issuedAtMillis) {

    public static final String CURRENT_VERSION = "1.0";

    public CursorPayload {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(fields, "fields");
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> copy.put(name, normalize(name, value)));
        fields = Collections.unmodifiableMap(copy);
    }

    public static CursorPayload of(Map<String, Object> fields, long issuedAtMillis) {
        return new CursorPayload(CURRENT_VERSION, fields, issuedAtMillis);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    private static Object normalize(String name, Object value) {
        if (value == null || value instanceof String || value instanceof Long
                || value instanceof BigDecimal || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString());
        }
        throw new IllegalArgumentException(
            "Cursor field '" + name + "' must be a JSON scalar, got " + value.getClass().getSimpleName());
    }
}
