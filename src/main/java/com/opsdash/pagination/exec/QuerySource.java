package com.opsdash.pagination.exec;

import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.predicate.Predicate;

import java.util.List;
import java.util.Set;

/**
 * A structured, filterable dataset the engine can page over.
 *
 * @param <T> row type
 */
public interface QuerySource<T> {

    /**
     * Dataset name, for logs and errors.
     */
    String name();

    /**
     * Columns that may appear in filters, orderings and cursors.
     */
    Set<String> columns();

    List<T> fetch(Predicate where, List<SortKey> order, int limit);

    long count(Predicate where);

    Object readField(T row, String field);
}
