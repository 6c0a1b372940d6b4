package com.opsdash.pagination.keyset;

import com.opsdash.pagination.predicate.Predicate;

import java.util.List;
import java.util.Objects;

/**
 * What to page over: the caller's business filter plus the dataset's keyset.
 */
public record QuerySpec(Predicate baseFilter, Keyset keyset) {

    public QuerySpec {
        baseFilter = baseFilter == null ? Predicate.all() : baseFilter;
        Objects.requireNonNull(keyset, "keyset");
    }

    public List<SortKey> order() {
        return keyset.order();
    }

    public List<CursorField> cursorFields() {
        return keyset.cursorFields();
    }
}
