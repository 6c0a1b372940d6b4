package com.opsdash.pagination.predicate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Row filter expressed as a small tree of comparison nodes.
 *
 * <p>Both the structured table path and the raw SQL path render the same tree, so
 * business filters and keyset conditions never travel as SQL text. Values are always
 * rendered as bound parameters; field names are checked by the renderer.
 *
 * <p>The factory methods simplify constant branches: {@code and(TRUE, p)} is {@code p},
 * {@code or(FALSE, p)} is {@code p}, an {@code and} containing {@code FALSE} is {@code FALSE}.
 */
public sealed interface Predicate
    permits Predicate.Comparison, Predicate.IsNull, Predicate.In, Predicate.Like,
            Predicate.And, Predicate.Or, Predicate.Constant {

    Constant TRUE = new Constant(true);
    Constant FALSE = new Constant(false);

    record Comparison(String field, Operator operator, Object value) implements Predicate {
        public Comparison {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
            if (value == null) {
                throw new IllegalArgumentException("Comparison against NULL on '" + field + "', use isNull()");
            }
        }
    }

    record IsNull(String field, boolean negated) implements Predicate {
        public IsNull {
            Objects.requireNonNull(field, "field");
        }
    }

    record In(String field, List<?> values) implements Predicate {
        public In {
            Objects.requireNonNull(field, "field");
            values = List.copyOf(values);
        }
    }

    /**
     * Pattern match; the pattern is bound as a parameter, wildcards are the caller's business.
     */
    record Like(String field, String pattern, boolean caseInsensitive) implements Predicate {
        public Like {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    record And(List<Predicate> terms) implements Predicate {
        public And {
            terms = List.copyOf(terms);
        }
    }

    record Or(List<Predicate> terms) implements Predicate {
        public Or {
            terms = List.copyOf(terms);
        }
    }

    record Constant(boolean value) implements Predicate {
    }

    static Predicate all() {
        return TRUE;
    }

    static Predicate eq(String field, Object value) {
        return new Comparison(field, Operator.EQ, value);
    }

    static Predicate ne(String field, Object value) {
        return new Comparison(field, Operator.NE, value);
    }

    static Predicate gt(String field, Object value) {
        return new Comparison(field, Operator.GT, value);
    }

    static Predicate gte(String field, Object value) {
        return new Comparison(field, Operator.GTE, value);
    }

    static Predicate lt(String field, Object value) {
        return new Comparison(field, Operator.LT, value);
    }

    static Predicate lte(String field, Object value) {
        return new Comparison(field, Operator.LTE, value);
    }

    static Predicate isNull(String field) {
        return new IsNull(field, false);
    }

    static Predicate isNotNull(String field) {
        return new IsNull(field, true);
    }

    static Predicate in(String field, List<?> values) {
        return values.isEmpty() ? FALSE : new In(field, values);
    }

    static Predicate iLike(String field, String pattern) {
        return new Like(field, pattern, true);
    }

    static Predicate and(Predicate... terms) {
        return and(Arrays.asList(terms));
    }

    static Predicate and(List<Predicate> terms) {
        List<Predicate> kept = new ArrayList<>();
        for (Predicate term : terms) {
            if (term == null || TRUE.equals(term)) {
                continue;
            }
            if (FALSE.equals(term)) {
                return FALSE;
            }
            if (term instanceof And nested) {
                kept.addAll(nested.terms());
            } else {
                kept.add(term);
            }
        }
        if (kept.isEmpty()) {
            return TRUE;
        }
        return kept.size() == 1 ? kept.get(0) : new And(kept);
    }

    static Predicate or(Predicate... terms) {
        return or(Arrays.asList(terms));
    }

    static Predicate or(List<Predicate> terms) {
        List<Predicate> kept = new ArrayList<>();
        for (Predicate term : terms) {
            if (term == null || FALSE.equals(term)) {
                continue;
            }
            if (TRUE.equals(term)) {
                return TRUE;
            }
            if (term instanceof Or nested) {
                kept.addAll(nested.terms());
            } else {
                kept.add(term);
            }
        }
        if (kept.isEmpty()) {
            return FALSE;
        }
        return kept.size() == 1 ? kept.get(0) : new Or(kept);
    }
}
