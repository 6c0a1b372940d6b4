package com.opsdash.pagination.exec;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.PaginationConfigurationException;
import com.opsdash.pagination.PaginationQueryException;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.keyset.CursorPosition;
import com.opsdash.pagination.keyset.KeysetPredicateBuilder;
import com.opsdash.pagination.keyset.QuerySpec;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.params.PaginationParams;
import com.opsdash.pagination.predicate.Predicate;
import com.opsdash.pagination.sql.PredicateSqlRenderer;
import com.opsdash.pagination.sql.SelectStatement;
import com.opsdash.pagination.sql.SqlFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyset pagination over a caller written SQL query, for aggregations the structured
 * sources cannot express. The query is wrapped as a CTE; the keyset condition, ordering
 * and limit are applied outside it, with every value bound as a parameter.
 */
public class RawSqlPageExecutor {

    private static final Logger log = LoggerFactory.getLogger(RawSqlPageExecutor.class);

    // Output columns of arbitrary SQL are unknown up front; identifiers are still validated.
    private static final PredicateSqlRenderer RENDERER = new PredicateSqlRenderer(Set.of());

    private final KeysetPredicateBuilder predicateBuilder = new KeysetPredicateBuilder();
    private final KeysetPageAssembler assembler;

    public RawSqlPageExecutor(CursorCodec codec, EdgeCursorPolicy edgeCursorPolicy) {
        this.assembler = new KeysetPageAssembler(codec, edgeCursorPolicy);
    }

    public <T> Result<PageResult<T>, CursorError> execute(
            RawSqlRunner runner,
            RawSqlQuery query,
            QuerySpec spec,
            PaginationParams params,
            RawRowMapper<T> mapper,
            boolean includeTotal) {

        CursorPosition position = null;
        if (params.hasCursor()) {
            Result<CursorPosition, CursorError> resolved = spec.keyset().resolve(params.cursor());
            if (resolved.isFailure()) {
                log.debug("Cursor does not fit raw query {}", query.name());
                return Result.failure(resolved.errorOrNull());
            }
            position = resolved.getOrThrow();
        }

        Predicate where = predicateBuilder.build(spec.baseFilter(), position, params.direction(), spec.order());
        List<SortKey> order = params.direction() == Direction.PREV ? spec.keyset().reversedOrder() : spec.order();

        SqlFragment select = renderPage(query, where, order, params.limit() + 1);

        List<Map<String, Object>> rows;
        Long total = null;
        try {
            rows = runner.queryForRows(select.sql(), select.parameters());
            if (includeTotal) {
                SqlFragment count = SelectStatement.wrapping(query.sql(), query.parameters())
                    .where(spec.baseFilter())
                    .renderCount(RENDERER);
                total = runner.queryForCount(count.sql(), count.parameters());
            }
        } catch (RuntimeException e) {
            throw new PaginationQueryException(query.name(), e);
        }

        log.debug("Fetched {} rows from raw query {} (limit={}, direction={})",
            rows.size(), query.name(), params.limit(), params.direction());

        return Result.success(assembler.assemble(
            rows, params, spec.keyset(), row -> field -> column(query, row, field), mapper::map, total));
    }

    private static Object column(RawSqlQuery query, Map<String, Object> row, String field) {
        if (!row.containsKey(field)) {
            throw new PaginationConfigurationException(
                "Cursor field '" + field + "' not found in the result of raw query '" + query.name() + "'");
        }
        return row.get(field);
    }

    static SqlFragment renderPage(RawSqlQuery query, Predicate where, List<SortKey> order, int fetchSize) {
        return SelectStatement.wrapping(query.sql(), query.parameters())
            .where(where)
            .orderBy(order)
            .limit(fetchSize)
            .render(RENDERER);
    }
}
