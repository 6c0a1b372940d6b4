package com.opsdash.pagination.sql;

import com.opsdash.pagination.predicate.Predicate;

import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders a {@link Predicate} tree as a SQL boolean expression. Every value becomes a
 * bound parameter; every field name is checked against the columns the source exposes.
 */
public class PredicateSqlRenderer {

    private final Set<String> columns;

    /**
     * @param columns columns predicates may reference; an empty set accepts any valid identifier
     */
    public PredicateSqlRenderer(Set<String> columns) {
        this.columns = Set.copyOf(columns);
    }

    public String render(Predicate predicate, ParameterBinder binder) {
        if (predicate instanceof Predicate.Constant constant) {
            return constant.value() ? "1 = 1" : "1 = 0";
        }
        if (predicate instanceof Predicate.Comparison comparison) {
            return column(comparison.field()) + " " + comparison.operator().symbol() + " "
                + binder.bind(comparison.value());
        }
        if (predicate instanceof Predicate.IsNull isNull) {
            return column(isNull.field()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (predicate instanceof Predicate.In in) {
            if (in.values().isEmpty()) {
                return "1 = 0";
            }
            StringJoiner placeholders = new StringJoiner(", ", column(in.field()) + " IN (", ")");
            in.values().forEach(value -> placeholders.add(binder.bind(value)));
            return placeholders.toString();
        }
        if (predicate instanceof Predicate.Like like) {
            return column(like.field()) + (like.caseInsensitive() ? " ILIKE " : " LIKE ")
                + binder.bind(like.pattern());
        }
        if (predicate instanceof Predicate.And and) {
            return join(and.terms(), " AND ", "1 = 1", binder);
        }
        if (predicate instanceof Predicate.Or or) {
            return join(or.terms(), " OR ", "1 = 0", binder);
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    private String join(Iterable<Predicate> terms, String separator, String empty, ParameterBinder binder) {
        StringJoiner joined = new StringJoiner(separator, "(", ")").setEmptyValue(empty);
        for (Predicate term : terms) {
            joined.add(render(term, binder));
        }
        return joined.toString();
    }

    private String column(String field) {
        SqlIdentifiers.require(field);
        if (!columns.isEmpty() && !columns.contains(field)) {
            throw new IllegalArgumentException("Unknown column '" + field + "'");
        }
        return field;
    }
}
