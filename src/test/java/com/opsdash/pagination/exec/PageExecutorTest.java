package com.opsdash.pagination.exec;

import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.PaginationQueryException;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.keyset.CursorField;
import com.opsdash.pagination.keyset.KeyType;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.keyset.QuerySpec;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.params.PaginationLimits;
import com.opsdash.pagination.params.PaginationParams;
import com.opsdash.pagination.params.ParamsValidator;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.predicate.Predicate;
import com.opsdash.pagination.support.InMemoryQuerySource;
import com.opsdash.pagination.support.TestCodecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static com.opsdash.pagination.support.InMemoryQuerySource.row;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PageExecutor")
class PageExecutorTest {

    private static final Instant BASE = Instant.parse("2024-01-15T10:00:00Z");

    private static final Keyset BY_CREATED = Keyset.of(
        List.of(SortKey.desc("created_at"), SortKey.desc("id")),
        List.of(CursorField.of("created_at", KeyType.INSTANT), CursorField.of("id", KeyType.LONG)));

    private final CursorCodec codec = TestCodecs.shared();
    private final ParamsValidator validator = new ParamsValidator(codec, PaginationLimits.DEFAULTS);

    private InMemoryQuerySource source;
    private PageExecutor executor;

    @BeforeEach
    void setUp() {
        source = new InMemoryQuerySource("events", "created_at", "id", "building_id");
        executor = new PageExecutor(codec, EdgeCursorPolicy.REMINT);
    }

    @Test
    @DisplayName("Should walk five rows in pages of two: [5,4], [3,2], [1]")
    void shouldWalkFiveRowsInPagesOfTwo() {
        for (long id = 1; id <= 5; id++) {
            source.add(row("created_at", BASE.plusSeconds(id), "id", id, "building_id", "B1"));
        }

        PageResult<Map<String, Object>> first = page(null, 2, "next", Predicate.all());
        assertEquals(List.of(5L, 4L), ids(first));
        assertTrue(first.metadata().hasNextPage());
        assertFalse(first.metadata().hasPrevPage());
        assertNotNull(first.metadata().nextCursor());
        assertNull(first.metadata().prevCursor());

        PageResult<Map<String, Object>> second = page(first.metadata().nextCursor(), 2, "next", Predicate.all());
        assertEquals(List.of(3L, 2L), ids(second));
        assertTrue(second.metadata().hasNextPage());
        assertTrue(second.metadata().hasPrevPage());

        PageResult<Map<String, Object>> third = page(second.metadata().nextCursor(), 2, "next", Predicate.all());
        assertEquals(List.of(1L), ids(third));
        assertFalse(third.metadata().hasNextPage());
        assertNull(third.metadata().nextCursor());
        assertEquals(1, third.metadata().count());
    }

    @Test
    @DisplayName("Should over-fetch by exactly one row in the order of travel")
    void shouldOverFetchByOne() {
        source.add(row("created_at", BASE, "id", 1L));

        page(null, 10, "next", Predicate.all());
        assertEquals(11, source.lastLimit());
        assertEquals(BY_CREATED.order(), source.lastOrder());

        String cursor = codec.mint(Map.of("created_at", BASE.toString(), "id", 1L));
        page(cursor, 10, "prev", Predicate.all());
        assertEquals(BY_CREATED.reversedOrder(), source.lastOrder());
    }

    @Test
    @DisplayName("Should visit every row exactly once when many rows share a timestamp")
    void shouldBeCompleteWithDuplicateTimestamps() {
        long id = 1;
        for (int second = 0; second < 4; second++) {
            for (int copy = 0; copy < 7; copy++) {
                source.add(row("created_at", BASE.plusSeconds(second), "id", id++, "building_id", copy % 2 == 0 ? "B1" : "B2"));
            }
        }

        List<Object> seen = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            PageResult<Map<String, Object>> page = page(cursor, 3, "next", Predicate.all());
            seen.addAll(ids(page));
            cursor = page.metadata().nextCursor();
            pages++;
        } while (cursor != null && pages < 100);

        assertEquals(28, seen.size());
        assertEquals(28, new HashSet<>(seen).size());
        assertEquals(10, pages);
    }

    @Test
    @DisplayName("Should only page through rows matching the base filter")
    void shouldApplyBaseFilter() {
        for (long id = 1; id <= 6; id++) {
            source.add(row("created_at", BASE.plusSeconds(id), "id", id, "building_id", id % 2 == 0 ? "B1" : "B2"));
        }
        Predicate filter = Predicate.eq("building_id", "B1");

        PageResult<Map<String, Object>> first = page(null, 2, "next", filter);
        PageResult<Map<String, Object>> second = page(first.metadata().nextCursor(), 2, "next", filter);

        assertEquals(List.of(6L, 4L), ids(first));
        assertEquals(List.of(2L), ids(second));
        assertFalse(second.metadata().hasNextPage());
    }

    @Nested
    @DisplayName("backwards")
    class BackwardTests {

        @BeforeEach
        void seed() {
            for (long id = 1; id <= 7; id++) {
                source.add(row("created_at", BASE.plusSeconds(id), "id", id));
            }
        }

        @Test
        @DisplayName("Should return the previous page again when following prev from the next page")
        void shouldBeReversible() {
            PageResult<Map<String, Object>> first = page(null, 3, "next", Predicate.all());
            PageResult<Map<String, Object>> second = page(first.metadata().nextCursor(), 3, "next", Predicate.all());

            PageResult<Map<String, Object>> back = page(second.metadata().prevCursor(), 3, "prev", Predicate.all());

            assertEquals(List.of(7L, 6L, 5L), ids(first));
            assertEquals(List.of(4L, 3L, 2L), ids(second));
            assertEquals(ids(first), ids(back));
            assertFalse(back.metadata().hasPrevPage());
            assertTrue(back.metadata().hasNextPage());

            PageResult<Map<String, Object>> forwardAgain = page(back.metadata().nextCursor(), 3, "next", Predicate.all());
            assertEquals(ids(second), ids(forwardAgain));
        }

        @Test
        @DisplayName("Should return rows in natural order after fetching backwards")
        void shouldRestoreNaturalOrder() {
            String cursor = codec.mint(Map.of("created_at", BASE.plusSeconds(2).toString(), "id", 2L));

            PageResult<Map<String, Object>> page = page(cursor, 2, "prev", Predicate.all());

            assertEquals(List.of(4L, 3L), ids(page));
            assertTrue(page.metadata().hasPrevPage());
            assertTrue(page.metadata().hasNextPage());
        }

        @Test
        @DisplayName("Should echo the incoming cursor as the opposite edge under pass-through")
        void shouldPassThroughIncomingCursor() {
            PageExecutor passThrough = new PageExecutor(codec, EdgeCursorPolicy.PASS_THROUGH);
            PageResult<Map<String, Object>> first = page(null, 3, "next", Predicate.all());
            String cursor = first.metadata().nextCursor();
            PaginationParams params = validator.parse(new RawPageParams(cursor, "3", "next")).getOrThrow();

            PageResult<Map<String, Object>> second =
                passThrough.execute(source, new QuerySpec(Predicate.all(), BY_CREATED), params, false).getOrThrow();

            assertEquals(cursor, second.metadata().prevCursor());
            assertTrue(second.metadata().hasPrevPage());
        }
    }

    @Test
    @DisplayName("Should return empty metadata when nothing matches")
    void shouldHandleEmptyResult() {
        PageResult<Map<String, Object>> page = page(null, 5, "next", Predicate.all());

        assertTrue(page.isEmpty());
        assertEquals(0, page.metadata().count());
        assertEquals(5, page.metadata().limit());
        assertFalse(page.metadata().hasNextPage());
        assertFalse(page.metadata().hasPrevPage());
        assertNull(page.metadata().nextCursor());
        assertNull(page.metadata().prevCursor());
    }

    @Test
    @DisplayName("Should count all rows matching the base filter only when asked")
    void shouldCountWhenAsked() {
        for (long id = 1; id <= 5; id++) {
            source.add(row("created_at", BASE.plusSeconds(id), "id", id));
        }
        PaginationParams params = validator.parse(new RawPageParams(null, "2", null)).getOrThrow();
        QuerySpec spec = new QuerySpec(Predicate.all(), BY_CREATED);

        assertEquals(5L, executor.execute(source, spec, params, true).getOrThrow().metadata().total());
        assertNull(executor.execute(source, spec, params, false).getOrThrow().metadata().total());
    }

    @Test
    @DisplayName("Should reject a valid token minted for another dataset without querying")
    void shouldRejectForeignCursor() {
        String foreign = codec.mint(Map.of("time_bucket", BASE.toString()));
        PaginationParams params = validator.parse(new RawPageParams(foreign, null, null)).getOrThrow();

        var result = executor.execute(source, new QuerySpec(null, BY_CREATED), params, false);

        assertInstanceOf(CursorError.Invalid.class, result.errorOrNull());
        assertEquals(0, source.fetchCount());
    }

    @Test
    @DisplayName("Should wrap data source failures in a query exception")
    void shouldWrapQueryFailures() {
        source.failWith(new IllegalStateException("connection reset"));
        PaginationParams params = PaginationParams.firstPage(10);

        var ex = assertThrows(PaginationQueryException.class,
            () -> executor.execute(source, new QuerySpec(null, BY_CREATED), params, false));

        assertEquals("events", ex.getDataset());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    private PageResult<Map<String, Object>> page(String cursor, int limit, String direction, Predicate filter) {
        PaginationParams params = validator.parse(new RawPageParams(cursor, String.valueOf(limit), direction)).getOrThrow();
        return executor.execute(source, new QuerySpec(filter, BY_CREATED), params, false).getOrThrow();
    }

    private static List<Object> ids(PageResult<Map<String, Object>> page) {
        return page.data().stream().map(row -> row.get("id")).toList();
    }

}
