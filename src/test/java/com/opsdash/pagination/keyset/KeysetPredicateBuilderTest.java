package com.opsdash.pagination.keyset;

import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.predicate.Predicate;
import com.opsdash.pagination.support.InMemoryQuerySource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.opsdash.pagination.support.InMemoryQuerySource.row;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeysetPredicateBuilder")
class KeysetPredicateBuilderTest {

    private static final Instant T = Instant.parse("2024-01-15T10:00:00Z");

    private final KeysetPredicateBuilder builder = new KeysetPredicateBuilder();

    @Test
    @DisplayName("Should return the base filter unchanged without a cursor")
    void shouldReturnBaseWithoutCursor() {
        Predicate base = Predicate.eq("building_id", "B1");

        assertEquals(base, builder.build(base, null, Direction.NEXT, List.of(SortKey.desc("id"))));
        assertEquals(Predicate.TRUE, builder.build(null, null, Direction.PREV, List.of(SortKey.desc("id"))));
    }

    @Test
    @DisplayName("Should expand a two-key descending order into an OR of ANDs")
    void shouldExpandLexicographically() {
        List<SortKey> order = List.of(SortKey.desc("created_at"), SortKey.desc("id"));
        CursorPosition position = position("created_at", T, "id", 7L);

        Predicate predicate = builder.build(Predicate.all(), position, Direction.NEXT, order);

        Predicate expected = Predicate.or(
            Predicate.lt("created_at", T),
            Predicate.and(Predicate.eq("created_at", T), Predicate.lt("id", 7L)));
        assertEquals(expected, predicate);
    }

    @Test
    @DisplayName("Should flip every comparison when paging backwards")
    void shouldFlipForPrev() {
        List<SortKey> order = List.of(SortKey.desc("created_at"), SortKey.desc("id"));
        CursorPosition position = position("created_at", T, "id", 7L);

        Predicate predicate = builder.build(Predicate.all(), position, Direction.PREV, order);

        Predicate expected = Predicate.or(
            Predicate.gt("created_at", T),
            Predicate.and(Predicate.eq("created_at", T), Predicate.gt("id", 7L)));
        assertEquals(expected, predicate);
    }

    @Test
    @DisplayName("Should honour mixed directions key by key")
    void shouldHonourMixedDirections() {
        List<SortKey> order = List.of(SortKey.asc("name"), SortKey.desc("id"));
        CursorPosition position = position("name", "m", "id", 3L);

        Predicate predicate = builder.build(Predicate.all(), position, Direction.NEXT, order);

        Predicate expected = Predicate.or(
            Predicate.gt("name", "m"),
            Predicate.and(Predicate.eq("name", "m"), Predicate.lt("id", 3L)));
        assertEquals(expected, predicate);
    }

    @Test
    @DisplayName("Should AND the keyset condition with the base filter")
    void shouldCombineWithBaseFilter() {
        Predicate base = Predicate.eq("building_id", "B1");
        List<SortKey> order = List.of(SortKey.asc("id"));

        Predicate predicate = builder.build(base, position("id", 3L), Direction.NEXT, order);

        assertEquals(Predicate.and(base, Predicate.gt("id", 3L)), predicate);
    }

    @Test
    @DisplayName("Should select exactly the rows after a NULL position on a nullable descending key")
    void shouldHandleNullPositionOnNullableKey() {
        // processing_time DESC NULLS LAST, id DESC
        List<SortKey> order = List.of(SortKey.desc("processing_time").asNullable(), SortKey.desc("id"));
        List<Map<String, Object>> rows = List.of(
            row("processing_time", 300L, "id", 1L),
            row("processing_time", 100L, "id", 2L),
            row("processing_time", null, "id", 9L),
            row("processing_time", null, "id", 5L),
            row("processing_time", null, "id", 3L));

        Predicate next = builder.build(null, position("processing_time", null, "id", 5L), Direction.NEXT, order);
        Predicate prev = builder.build(null, position("processing_time", null, "id", 5L), Direction.PREV, order);

        assertEquals(List.of(3L), ids(rows, next));
        assertEquals(List.of(1L, 2L, 9L), ids(rows, prev));
    }

    @Test
    @DisplayName("Should include NULL rows after the last non-null value on a nullable descending key")
    void shouldReachNullsFromNonNullPosition() {
        List<SortKey> order = List.of(SortKey.desc("processing_time").asNullable(), SortKey.desc("id"));
        List<Map<String, Object>> rows = List.of(
            row("processing_time", 300L, "id", 1L),
            row("processing_time", 100L, "id", 2L),
            row("processing_time", 100L, "id", 1L),
            row("processing_time", null, "id", 9L));

        Predicate next = builder.build(null, position("processing_time", 100L, "id", 2L), Direction.NEXT, order);

        assertEquals(List.of(1L, 9L), ids(rows, next));
    }

    @Test
    @DisplayName("Should refuse a NULL value for a non-nullable key")
    void shouldRefuseNullForNonNullableKey() {
        List<SortKey> order = List.of(SortKey.desc("created_at"), SortKey.desc("id"));

        assertThrows(IllegalArgumentException.class,
            () -> builder.build(null, position("created_at", null, "id", 1L), Direction.NEXT, order));
    }

    private static CursorPosition position(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new CursorPosition(values);
    }

    private static List<Object> ids(List<Map<String, Object>> rows, Predicate predicate) {
        return rows.stream()
            .filter(row -> InMemoryQuerySource.matches(predicate, row))
            .map(row -> row.get("id"))
            .toList();
    }
}
