package com.opsdash.pagination;

/**
 * Pagination facts returned with every page. {@code total} is only filled when the
 * caller asked for an exact count.
 */
public record PageMetadata(
    int limit,
    int count,
    boolean hasNextPage,
    boolean hasPrevPage,
    String nextCursor,
    String prevCursor,
    Long total
) {
    public static PageMetadata empty(int limit, Long total) {
        return new PageMetadata(limit, 0, false, false, null, null, total);
    }
}
