package com.opsdash.pagination.params;

/**
 * Pagination parameters exactly as they arrived from the client, all optional.
 */
public record RawPageParams(String cursor, String limit, String direction) {

    public static RawPageParams none() {
        return new RawPageParams(null, null, null);
    }

    public static RawPageParams of(String cursor, Integer limit, String direction) {
        return new RawPageParams(cursor, limit == null ? null : limit.toString(), direction);
    }
}
