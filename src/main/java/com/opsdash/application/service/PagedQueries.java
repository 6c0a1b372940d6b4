package com.opsdash.application.service;

import com.opsdash.application.port.out.MetricsPort;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PageOptions;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.Paginator;
import com.opsdash.pagination.cursor.CursorError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one page request against a paginator, timing it and counting served pages and
 * rejected cursors per dataset.
 */
final class PagedQueries {

    private static final Logger log = LoggerFactory.getLogger(PagedQueries.class);

    private final MetricsPort metrics;

    PagedQueries(MetricsPort metrics) {
        this.metrics = metrics;
    }

    <T> Result<PageResult<T>, ListingError> fetch(String dataset, Paginator<T> paginator, PageOptions options) {
        Result<PageResult<T>, CursorError> result =
            metrics.recordPageQuery(dataset, () -> paginator.paginate(options));

        if (result.isFailure()) {
            CursorError error = result.errorOrNull();
            metrics.incrementCursorRejections(error.reason());
            log.warn("Cursor rejected: dataset={}, reason={}", dataset, error.reason());
            return Result.failure(new ListingError.InvalidCursor(error));
        }

        PageResult<T> page = result.getOrThrow();
        metrics.incrementPagesServed(dataset);
        log.debug("Page served: dataset={}, count={}, hasNext={}, hasPrev={}",
            dataset, page.metadata().count(), page.metadata().hasNextPage(), page.metadata().hasPrevPage());
        return Result.success(page);
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Wraps free text as a LIKE pattern matching it anywhere, with its own wildcards escaped.
     */
    static String containsPattern(String text) {
        String escaped = text.trim()
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
