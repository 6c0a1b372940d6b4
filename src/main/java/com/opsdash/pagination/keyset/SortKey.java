package com.opsdash.pagination.keyset;

import java.util.Objects;

/**
 * One entry of a dataset's ordering. {@code nullable} marks columns that may hold NULL;
 * those are ordered and compared with NULL below every non-null value.
 */
public record SortKey(String field, SortDirection direction, boolean nullable) {

    public SortKey {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortKey asc(String field) {
        return new SortKey(field, SortDirection.ASC, false);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, SortDirection.DESC, false);
    }

    public SortKey asNullable() {
        return new SortKey(field, direction, true);
    }

    public SortKey reversed() {
        return new SortKey(field, direction.flip(), nullable);
    }
}
