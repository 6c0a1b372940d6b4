package com.opsdash.pagination.keyset;

import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.predicate.Predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the "rows strictly after this position" condition for keyset pagination.
 *
 * <p>For an order {@code (k1, ..., kn)} and cursor values {@code (v1, ..., vn)} the result is
 * the lexicographic expansion
 * <pre>
 *   after(k1, v1)
 *   OR (k1 = v1 AND after(k2, v2))
 *   OR ...
 *   OR (k1 = v1 AND ... AND k(n-1) = v(n-1) AND after(kn, vn))
 * </pre>
 * where {@code after} is {@code >} for a key sorted ascending and {@code <} for a key sorted
 * descending, both inverted when paging backwards.
 *
 * <p>Nullable keys order NULL below every non-null value (NULLS FIRST ascending, NULLS LAST
 * descending). The comparisons are expanded to match, so the result never depends on the
 * database's own NULL ordering.
 */
public class KeysetPredicateBuilder {

    public Predicate build(Predicate baseFilter, CursorPosition position, Direction direction, List<SortKey> order) {
        Predicate base = baseFilter == null ? Predicate.all() : baseFilter;
        if (position == null) {
            return base;
        }

        List<Predicate> branches = new ArrayList<>();
        List<Predicate> equalPrefix = new ArrayList<>();
        for (SortKey key : order) {
            Object value = key.nullable() ? position.value(key.field()) : requireValue(position, key);

            SortDirection effective = direction == Direction.PREV ? key.direction().flip() : key.direction();
            Predicate after = effective == SortDirection.ASC
                ? greater(key, value)
                : less(key, value);

            List<Predicate> branch = new ArrayList<>(equalPrefix);
            branch.add(after);
            branches.add(Predicate.and(branch));

            equalPrefix.add(equal(key, value));
        }
        return Predicate.and(base, Predicate.or(branches));
    }

    private static Object requireValue(CursorPosition position, SortKey key) {
        Object value = position.value(key.field());
        if (value == null) {
            throw new IllegalArgumentException("Cursor value for non-nullable key '" + key.field() + "' is NULL");
        }
        return value;
    }

    private static Predicate greater(SortKey key, Object value) {
        if (value == null) {
            return Predicate.isNotNull(key.field());
        }
        return Predicate.gt(key.field(), value);
    }

    private static Predicate less(SortKey key, Object value) {
        if (value == null) {
            return Predicate.FALSE;
        }
        if (key.nullable()) {
            return Predicate.or(Predicate.lt(key.field(), value), Predicate.isNull(key.field()));
        }
        return Predicate.lt(key.field(), value);
    }

    private static Predicate equal(SortKey key, Object value) {
        return value == null ? Predicate.isNull(key.field()) : Predicate.eq(key.field(), value);
    }
}
