package com.opsdash.pagination.params;

import com.opsdash.pagination.cursor.CursorPayload;

/**
 * Normalised pagination input: a clamped limit, a direction and, when the client sent
 * one, the raw cursor token next to its decoded payload.
 */
public record PaginationParams(int limit, Direction direction, String rawCursor, CursorPayload cursor) {

    public boolean hasCursor() {
        return cursor != null;
    }

    public static PaginationParams firstPage(int limit) {
        return new PaginationParams(limit, Direction.NEXT, null, null);
    }
}
