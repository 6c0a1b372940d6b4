package com.opsdash.pagination.exec;

import java.util.Map;

@FunctionalInterface
public interface RawRowMapper<T> {

    T map(Map<String, Object> row);
}
