package com.opsdash.pagination.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL text with named placeholders ({@code :name}) and the values bound to them.
 */
public record SqlFragment(String sql, Map<String, Object> parameters) {

    public SqlFragment {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
