package com.opsdash.adapter.out.persistence;

import com.opsdash.pagination.exec.QuerySource;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.predicate.Predicate;
import com.opsdash.pagination.sql.PredicateSqlRenderer;
import com.opsdash.pagination.sql.SelectStatement;
import com.opsdash.pagination.sql.SqlFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * A single table exposed as a pageable source. Only the listed columns may be filtered,
 * ordered or carried in cursors.
 */
public class JdbcQuerySource<T> implements QuerySource<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcQuerySource.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final String table;
    private final Set<String> columns;
    private final RowMapper<T> rowMapper;
    private final BiFunction<T, String, Object> fieldReader;
    private final PredicateSqlRenderer renderer;

    public JdbcQuerySource(
            NamedParameterJdbcTemplate jdbc,
            String table,
            Set<String> columns,
            RowMapper<T> rowMapper,
            BiFunction<T, String, Object> fieldReader) {
        this.jdbc = jdbc;
        this.table = table;
        this.columns = Set.copyOf(columns);
        this.rowMapper = rowMapper;
        this.fieldReader = fieldReader;
        this.renderer = new PredicateSqlRenderer(this.columns);
    }

    @Override
    public String name() {
        return table;
    }

    @Override
    public Set<String> columns() {
        return columns;
    }

    @Override
    public List<T> fetch(Predicate where, List<SortKey> order, int limit) {
        SqlFragment select = SelectStatement.fromTable(table)
            .where(where)
            .orderBy(order)
            .limit(limit)
            .render(renderer);
        log.trace("Fetching page: sql={}", select.sql());
        return jdbc.query(select.sql(), select.parameters(), rowMapper);
    }

    @Override
    public long count(Predicate where) {
        SqlFragment count = SelectStatement.fromTable(table).where(where).renderCount(renderer);
        Long total = jdbc.queryForObject(count.sql(), count.parameters(), Long.class);
        return total != null ? total : 0;
    }

    @Override
    public Object readField(T row, String field) {
        return fieldReader.apply(row, field);
    }
}
