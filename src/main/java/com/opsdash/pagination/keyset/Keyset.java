package com.opsdash.pagination.keyset;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PaginationConfigurationException;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.cursor.CursorPayload;
import com.opsdash.pagination.sql.SqlIdentifiers;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The ordering of a dataset together with the fields its cursors carry.
 *
 * <p>{@code order.get(0)} is the primary key of the range comparison; the last order key
 * is the tie-breaker and must be unique and non-nullable. Every order field must also be
 * a cursor field, otherwise a cursor could not be turned back into a position.
 * All of this is checked here, once, when the dataset is wired.
 */
public record Keyset(List<SortKey> order, List<CursorField> cursorFields) {

    private static final Set<String> RESERVED = Set.of(CursorCodec.VERSION_KEY, CursorCodec.ISSUED_AT_KEY);

    public Keyset {
        if (order == null || order.isEmpty()) {
            throw new PaginationConfigurationException("Keyset ordering must not be empty");
        }
        if (cursorFields == null || cursorFields.isEmpty()) {
            throw new PaginationConfigurationException("Keyset must declare at least one cursor field");
        }
        order = List.copyOf(order);
        cursorFields = List.copyOf(cursorFields);

        Set<String> cursorNames = new HashSet<>();
        for (CursorField field : cursorFields) {
            checkName(field.name());
            if (!cursorNames.add(field.name())) {
                throw new PaginationConfigurationException("Duplicate cursor field '" + field.name() + "'");
            }
        }
        Set<String> orderNames = new HashSet<>();
        for (SortKey key : order) {
            checkName(key.field());
            if (!orderNames.add(key.field())) {
                throw new PaginationConfigurationException("Duplicate order field '" + key.field() + "'");
            }
            if (!cursorNames.contains(key.field())) {
                throw new PaginationConfigurationException(
                    "Order field '" + key.field() + "' is not one of the cursor fields " + cursorNames);
            }
        }
        if (order.get(order.size() - 1).nullable()) {
            throw new PaginationConfigurationException(
                "Tie-breaker '" + order.get(order.size() - 1).field() + "' must not be nullable");
        }
    }

    public static Keyset of(List<SortKey> order, List<CursorField> cursorFields) {
        return new Keyset(order, cursorFields);
    }

    public List<SortKey> reversedOrder() {
        return order.stream().map(SortKey::reversed).toList();
    }

    /**
     * Fails unless every cursor field is one of the given columns.
     */
    public void requireAvailable(Collection<String> columns, String dataset) {
        for (CursorField field : cursorFields) {
            if (!columns.contains(field.name())) {
                throw new PaginationConfigurationException(
                    "Cursor field '" + field.name() + "' not found in dataset '" + dataset + "'");
            }
        }
    }

    /**
     * Reads the typed position out of a decoded cursor. A payload minted for another
     * dataset, or carrying values of the wrong type, is reported as an invalid cursor.
     */
    public Result<CursorPosition, CursorError> resolve(CursorPayload payload) {
        if (payload.fields().size() != cursorFields.size()) {
            return Result.failure(CursorError.Invalid.INSTANCE);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (CursorField field : cursorFields) {
            if (!payload.hasField(field.name())) {
                return Result.failure(CursorError.Invalid.INSTANCE);
            }
            Object json = payload.field(field.name());
            if (json == null && !isNullable(field.name())) {
                return Result.failure(CursorError.Invalid.INSTANCE);
            }
            try {
                values.put(field.name(), field.type().fromJson(json));
            } catch (IllegalArgumentException e) {
                return Result.failure(CursorError.Invalid.INSTANCE);
            }
        }
        return Result.success(new CursorPosition(values));
    }

    /**
     * Collects the cursor field values of a row, in cursor JSON form.
     *
     * @throws IllegalStateException if a non-nullable cursor field is NULL in the row
     */
    public Map<String, Object> cursorValues(Function<String, Object> rowReader) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (CursorField field : cursorFields) {
            Object canonical = field.type().normalize(rowReader.apply(field.name()));
            if (canonical == null && !isNullable(field.name())) {
                throw new IllegalStateException(
                    "Cursor field '" + field.name() + "' is NULL but not declared nullable");
            }
            values.put(field.name(), field.type().toJson(canonical));
        }
        return values;
    }

    public Set<String> cursorFieldNames() {
        return cursorFields.stream().map(CursorField::name).collect(Collectors.toUnmodifiableSet());
    }

    private boolean isNullable(String field) {
        return order.stream().anyMatch(key -> key.field().equals(field) && key.nullable());
    }

    private static void checkName(String name) {
        if (RESERVED.contains(name)) {
            throw new PaginationConfigurationException("Cursor field name '" + name + "' is reserved");
        }
        if (!SqlIdentifiers.isValid(name)) {
            throw new PaginationConfigurationException("Illegal field name '" + name + "'");
        }
    }
}
