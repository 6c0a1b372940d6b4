package com.opsdash.pagination;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.predicate.Predicate;

import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A dataset bound to a fixed ordering and cursor field set, paged with encrypted cursors.
 * Obtained from {@link PaginatorFactory}.
 *
 * @param <T> row type
 */
public interface Paginator<T> {

    Result<PageResult<T>, CursorError> paginate(PageOptions options);

    default Result<PageResult<T>, CursorError> findPage(Predicate filter, RawPageParams params) {
        return paginate(PageOptions.of(filter, params));
    }

    default Result<PageResult<T>, CursorError> findNextPage(String cursor, Predicate filter) {
        return paginate(PageOptions.builder().filter(filter).cursor(cursor).direction(Direction.NEXT).build());
    }

    default Result<PageResult<T>, CursorError> findPrevPage(String cursor, Predicate filter) {
        return paginate(PageOptions.builder().filter(filter).cursor(cursor).direction(Direction.PREV).build());
    }

    /**
     * Lazily walks every page forward from the start, one query per page.
     */
    default Stream<List<T>> stream(Predicate filter, int batchSize) {
        PageIterator<T> pages = new PageIterator<>(this, filter, batchSize);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }
}
