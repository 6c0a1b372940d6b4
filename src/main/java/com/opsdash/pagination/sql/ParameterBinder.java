package com.opsdash.pagination.sql;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands out placeholder names for generated SQL. Generated names use the reserved
 * {@code ks_} prefix so they cannot collide with a caller's own named parameters.
 */
public class ParameterBinder {

    public static final String RESERVED_PREFIX = "ks_";

    private final Map<String, Object> values = new LinkedHashMap<>();
    private int next;

    /**
     * Registers a value and returns its placeholder, including the leading colon.
     */
    public String bind(Object value) {
        String name = RESERVED_PREFIX + "p" + next++;
        values.put(name, toJdbc(value));
        return ":" + name;
    }

    public String bindNamed(String suffix, Object value) {
        String name = RESERVED_PREFIX + suffix;
        if (values.containsKey(name)) {
            throw new IllegalStateException("Parameter " + name + " bound twice");
        }
        values.put(name, toJdbc(value));
        return ":" + name;
    }

    public Map<String, Object> values() {
        return values;
    }

    private static Object toJdbc(Object value) {
        return value instanceof Instant instant ? Timestamp.from(instant) : value;
    }
}
