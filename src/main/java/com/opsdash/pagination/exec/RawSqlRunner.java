package com.opsdash.pagination.exec;

import java.util.List;
import java.util.Map;

/**
 * Executes generated SQL with named parameters. Rows come back as column label to value maps.
 */
public interface RawSqlRunner {

    List<Map<String, Object>> queryForRows(String sql, Map<String, Object> parameters);

    long queryForCount(String sql, Map<String, Object> parameters);
}
