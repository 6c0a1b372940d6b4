package com.opsdash.pagination.exec;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PageResult;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Serves one page of a {@link QuerySource} using the over-fetch-by-one keyset strategy.
 */
public class PageExecutor {

    private static final Logger log = LoggerFactory.getLogger(PageExecutor.class);

    private final KeysetPredicateBuilder predicateBuilder;
    private final KeysetPageAssembler assembler;

    public PageExecutor(CursorCodec codec, EdgeCursorPolicy edgeCursorPolicy) {
        this(new KeysetPredicateBuilder(), codec, edgeCursorPolicy);
    }

    PageExecutor(KeysetPredicateBuilder predicateBuilder, CursorCodec codec, EdgeCursorPolicy edgeCursorPolicy) {
        this.predicateBuilder = predicateBuilder;
        this.assembler = new KeysetPageAssembler(codec, edgeCursorPolicy);
    }

    public <T> Result<PageResult<T>, CursorError> execute(
            QuerySource<T> source,
            QuerySpec spec,
            PaginationParams params,
            boolean includeTotal) {

        CursorPosition position = null;
        if (params.hasCursor()) {
            Result<CursorPosition, CursorError> resolved = spec.keyset().resolve(params.cursor());
            if (resolved.isFailure()) {
                log.debug("Cursor does not fit dataset {}", source.name());
                return Result.failure(resolved.errorOrNull());
            }
            position = resolved.getOrThrow();
        }

        Predicate where = predicateBuilder.build(spec.baseFilter(), position, params.direction(), spec.order());
        List<SortKey> order = params.direction() == Direction.PREV ? spec.keyset().reversedOrder() : spec.order();

        List<T> rows;
        Long total = null;
        try {
            rows = source.fetch(where, order, params.limit() + 1);
            if (includeTotal) {
                total = source.count(spec.baseFilter());
            }
        } catch (PaginationQueryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PaginationQueryException(source.name(), e);
        }

        log.debug("Fetched {} rows from {} (limit={}, direction={}, cursor={})",
            rows.size(), source.name(), params.limit(), params.direction(), position != null ? "present" : "none");

        return Result.success(assembler.assemble(
            rows, params, spec.keyset(), row -> field -> source.readField(row, field), Function.identity(), total));
    }
}
