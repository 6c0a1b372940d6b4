package com.opsdash.pagination.sql;

import com.opsdash.pagination.keyset.SortDirection;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.predicate.Predicate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Minimal SELECT template used by the paginators. Two shapes are supported:
 * <pre>
 *   SELECT * FROM &lt;table&gt; WHERE ... ORDER BY ... LIMIT :ks_limit
 *   WITH paginated_source AS (&lt;caller sql&gt;) SELECT * FROM paginated_source WHERE ... ORDER BY ... LIMIT :ks_limit
 * </pre>
 * and the matching {@code COUNT(*)} forms. Only identifiers are written into the text;
 * everything else is a named parameter.
 */
public final class SelectStatement {

    static final String CTE_NAME = "paginated_source";

    private final String table;
    private final String rawSql;
    private final Map<String, Object> rawParameters;
    private Predicate where = Predicate.all();
    private List<SortKey> order = List.of();
    private Integer limit;

    private SelectStatement(String table, String rawSql, Map<String, Object> rawParameters) {
        this.table = table;
        this.rawSql = rawSql;
        this.rawParameters = rawParameters;
    }

    public static SelectStatement fromTable(String table) {
        return new SelectStatement(SqlIdentifiers.require(table), null, Map.of());
    }

    /**
     * Wraps a caller supplied query as a common table expression. The query's own named
     * parameters are carried over; they may not use the reserved {@code ks_} prefix.
     */
    public static SelectStatement wrapping(String sql, Map<String, Object> parameters) {
        Objects.requireNonNull(sql, "sql");
        String trimmed = stripTrailingSemicolons(sql);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Raw SQL must not be empty");
        }
        for (String name : parameters.keySet()) {
            if (name.startsWith(ParameterBinder.RESERVED_PREFIX)) {
                throw new IllegalArgumentException(
                    "Parameter name '" + name + "' uses the reserved prefix " + ParameterBinder.RESERVED_PREFIX);
            }
        }
        return new SelectStatement(null, trimmed, new LinkedHashMap<>(parameters));
    }

    public SelectStatement where(Predicate predicate) {
        this.where = predicate == null ? Predicate.all() : predicate;
        return this;
    }

    public SelectStatement orderBy(List<SortKey> keys) {
        this.order = List.copyOf(keys);
        return this;
    }

    public SelectStatement limit(int rows) {
        if (rows < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + rows);
        }
        this.limit = rows;
        return this;
    }

    public SqlFragment render(PredicateSqlRenderer renderer) {
        ParameterBinder binder = new ParameterBinder();
        StringBuilder sql = new StringBuilder();
        appendSource(sql, "SELECT *");
        appendWhere(sql, renderer, binder);

        if (!order.isEmpty()) {
            StringJoiner terms = new StringJoiner(", ", " ORDER BY ", "");
            order.forEach(key -> terms.add(orderTerm(key)));
            sql.append(terms);
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(binder.bindNamed("limit", limit));
        }
        return fragment(sql, binder);
    }

    public SqlFragment renderCount(PredicateSqlRenderer renderer) {
        ParameterBinder binder = new ParameterBinder();
        StringBuilder sql = new StringBuilder();
        appendSource(sql, "SELECT COUNT(*)");
        appendWhere(sql, renderer, binder);
        return fragment(sql, binder);
    }

    private void appendSource(StringBuilder sql, String projection) {
        if (rawSql != null) {
            sql.append("WITH ").append(CTE_NAME).append(" AS (\n")
                .append(rawSql)
                .append("\n) ")
                .append(projection).append(" FROM ").append(CTE_NAME);
        } else {
            sql.append(projection).append(" FROM ").append(table);
        }
    }

    private void appendWhere(StringBuilder sql, PredicateSqlRenderer renderer, ParameterBinder binder) {
        if (!Predicate.TRUE.equals(where)) {
            sql.append(" WHERE ").append(renderer.render(where, binder));
        }
    }

    private SqlFragment fragment(StringBuilder sql, ParameterBinder binder) {
        Map<String, Object> parameters = new LinkedHashMap<>(rawParameters);
        parameters.putAll(binder.values());
        return new SqlFragment(sql.toString(), parameters);
    }

    static String orderTerm(SortKey key) {
        String term = SqlIdentifiers.require(key.field()) + " " + key.direction().name();
        if (!key.nullable()) {
            return term;
        }
        // NULL sorts below every value, whatever the engine's default
        return term + (key.direction() == SortDirection.ASC ? " NULLS FIRST" : " NULLS LAST");
    }

    private static String stripTrailingSemicolons(String sql) {
        String trimmed = sql.strip();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed;
    }
}
