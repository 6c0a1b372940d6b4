package com.opsdash.pagination;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.predicate.Predicate;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates the pages of a paginator, fetching each only when asked for.
 * Not thread-safe.
 */
class PageIterator<T> implements Iterator<List<T>> {

    private final Paginator<T> paginator;
    private final Predicate filter;
    private final int batchSize;

    private String cursor;
    private PageResult<T> pending;
    private boolean finished;

    PageIterator(Paginator<T> paginator, Predicate filter, int batchSize) {
        this.paginator = paginator;
        this.filter = filter;
        this.batchSize = batchSize;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Result<PageResult<T>, CursorError> result = paginator.paginate(PageOptions.builder()
            .filter(filter)
            .cursor(cursor)
            .limit(batchSize)
            .direction(Direction.NEXT)
            .build());
        if (result.isFailure()) {
            // Cursors here were minted moments ago by this very iterator
            finished = true;
            throw new IllegalStateException("Self-minted cursor rejected: " + result.errorOrNull().reason());
        }
        PageResult<T> page = result.getOrThrow();
        cursor = page.metadata().nextCursor();
        finished = !page.metadata().hasNextPage();
        if (page.isEmpty()) {
            return false;
        }
        pending = page;
        return true;
    }

    @Override
    public List<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more pages");
        }
        List<T> data = pending.data();
        pending = null;
        return data;
    }
}
