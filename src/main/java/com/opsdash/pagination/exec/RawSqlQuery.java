package com.opsdash.pagination.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A caller written query (typically an aggregation) with its own named parameters.
 * The engine wraps it; it never edits the text.
 */
public record RawSqlQuery(String name, String sql, Map<String, Object> parameters) {

    public RawSqlQuery {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sql, "sql");
        // LinkedHashMap instead of Map.copyOf: bound values may legitimately be null
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters == null ? Map.of() : parameters));
    }

    public static RawSqlQuery of(String name, String sql, Map<String, Object> parameters) {
        return new RawSqlQuery(name, sql, parameters);
    }
}
