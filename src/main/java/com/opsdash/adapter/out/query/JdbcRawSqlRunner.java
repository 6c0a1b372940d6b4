package com.opsdash.adapter.out.query;

import com.opsdash.pagination.exec.RawSqlRunner;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs the engine's generated statements for hand-written analytical queries.
 */
@Component
public class JdbcRawSqlRunner implements RawSqlRunner {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcRawSqlRunner(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Map<String, Object>> queryForRows(String sql, Map<String, Object> parameters) {
        return jdbc.queryForList(sql, parameters);
    }

    @Override
    public long queryForCount(String sql, Map<String, Object> parameters) {
        Long count = jdbc.queryForObject(sql, parameters, Long.class);
        return count != null ? count : 0;
    }
}
