package com.opsdash.pagination.exec;

/**
 * How the cursor on the edge opposite to the traversal direction is produced when the
 * request carried a cursor.
 */
public enum EdgeCursorPolicy {

    /**
     * Hand the incoming token back unmodified. The returned cursor points at the previous
     * page's edge row, so following it back returns only the rows strictly beyond that
     * row and skips the row itself.
     */
    PASS_THROUGH,

    /**
     * Mint it from the opposite edge row, so following it returns exactly the page the
     * client came from.
     */
    REMINT
}
