package com.opsdash.pagination;

import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.exec.EdgeCursorPolicy;
import com.opsdash.pagination.exec.PageExecutor;
import com.opsdash.pagination.exec.QuerySource;
import com.opsdash.pagination.exec.RawRowMapper;
import com.opsdash.pagination.exec.RawSqlPageExecutor;
import com.opsdash.pagination.exec.RawSqlQuery;
import com.opsdash.pagination.exec.RawSqlRunner;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.keyset.QuerySpec;
import com.opsdash.pagination.params.PaginationLimits;
import com.opsdash.pagination.params.ParamsValidator;

import java.util.Objects;

/**
 * Entry point of the pagination engine. Holds the process-wide codec and limits and binds
 * datasets to their keyset once, so a dataset always pages with the same ordering.
 * Configuration mistakes surface here as {@link PaginationConfigurationException}.
 */
public class PaginatorFactory {

    private final ParamsValidator paramsValidator;
    private final PageExecutor pageExecutor;
    private final RawSqlPageExecutor rawSqlPageExecutor;

    public PaginatorFactory(CursorCodec codec, PaginationLimits limits, EdgeCursorPolicy edgeCursorPolicy) {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(edgeCursorPolicy, "edgeCursorPolicy");
        this.paramsValidator = new ParamsValidator(codec, limits);
        this.pageExecutor = new PageExecutor(codec, edgeCursorPolicy);
        this.rawSqlPageExecutor = new RawSqlPageExecutor(codec, edgeCursorPolicy);
    }

    public <T> Paginator<T> forSource(QuerySource<T> source, Keyset keyset) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(keyset, "keyset");
        keyset.requireAvailable(source.columns(), source.name());
        return options -> paramsValidator.parse(options.page())
            .flatMap(params -> pageExecutor.execute(
                source, new QuerySpec(options.filter(), keyset), params, options.includeTotal()));
    }

    /**
     * Binds one raw query (with its parameter values) to a keyset. The filter passed per call
     * applies to the query's output columns.
     */
    public <T> Paginator<T> forRawSql(RawSqlRunner runner, RawSqlQuery query, Keyset keyset, RawRowMapper<T> mapper) {
        Objects.requireNonNull(runner, "runner");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(keyset, "keyset");
        Objects.requireNonNull(mapper, "mapper");
        if (query.sql().isBlank()) {
            throw new PaginationConfigurationException("Raw query '" + query.name() + "' is empty");
        }
        return options -> paramsValidator.parse(options.page())
            .flatMap(params -> rawSqlPageExecutor.execute(
                runner, query, new QuerySpec(options.filter(), keyset), params, mapper, options.includeTotal()));
    }
}
