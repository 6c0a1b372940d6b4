package com.opsdash.pagination.exec;

import com.opsdash.pagination.PageMetadata;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.params.PaginationParams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Turns the {@code limit + 1} rows of a keyset query into a page: detects whether more rows
 * exist, trims, restores natural order after a backwards fetch and mints the edge cursors.
 */
class KeysetPageAssembler {

    private final CursorCodec codec;
    private final EdgeCursorPolicy edgeCursorPolicy;

    KeysetPageAssembler(CursorCodec codec, EdgeCursorPolicy edgeCursorPolicy) {
        this.codec = codec;
        this.edgeCursorPolicy = edgeCursorPolicy;
    }

    /**
     * @param fetched   rows as returned by the query, nearest to the cursor first
     * @param readerFor gives, for a row, a lookup of field name to raw value
     */
    <R, T> PageResult<T> assemble(
            List<R> fetched,
            PaginationParams params,
            Keyset keyset,
            Function<R, Function<String, Object>> readerFor,
            Function<R, T> mapper,
            Long total) {

        int limit = params.limit();
        boolean hasMore = fetched.size() > limit;
        List<R> rows = new ArrayList<>(hasMore ? fetched.subList(0, limit) : fetched);

        if (rows.isEmpty()) {
            return new PageResult<>(List.of(), PageMetadata.empty(limit, total));
        }
        if (params.direction() == Direction.PREV) {
            Collections.reverse(rows);
        }

        R first = rows.get(0);
        R last = rows.get(rows.size() - 1);
        String nextCursor;
        String prevCursor;
        if (params.direction() == Direction.NEXT) {
            nextCursor = hasMore ? mint(keyset, readerFor.apply(last)) : null;
            prevCursor = oppositeEdge(params, keyset, readerFor.apply(first));
        } else {
            prevCursor = hasMore ? mint(keyset, readerFor.apply(first)) : null;
            nextCursor = oppositeEdge(params, keyset, readerFor.apply(last));
        }

        List<T> data = rows.stream().map(mapper).toList();
        PageMetadata metadata = new PageMetadata(
            limit, data.size(), nextCursor != null, prevCursor != null, nextCursor, prevCursor, total);
        return new PageResult<>(data, metadata);
    }

    private String oppositeEdge(PaginationParams params, Keyset keyset, Function<String, Object> edge) {
        if (!params.hasCursor()) {
            return null;
        }
        return edgeCursorPolicy == EdgeCursorPolicy.PASS_THROUGH
            ? params.rawCursor()
            : mint(keyset, edge);
    }

    private String mint(Keyset keyset, Function<String, Object> row) {
        return codec.mint(keyset.cursorValues(row));
    }
}
