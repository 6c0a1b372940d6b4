package com.opsdash.pagination;

import com.opsdash.pagination.cursor.CursorError;
import com.opsdash.pagination.exec.EdgeCursorPolicy;
import com.opsdash.pagination.exec.RawSqlQuery;
import com.opsdash.pagination.exec.RawSqlRunner;
import com.opsdash.pagination.keyset.CursorField;
import com.opsdash.pagination.keyset.KeyType;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.params.PaginationLimits;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.predicate.Predicate;
import com.opsdash.pagination.support.InMemoryQuerySource;
import com.opsdash.pagination.support.TestCodecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.opsdash.pagination.support.InMemoryQuerySource.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("PaginatorFactory")
class PaginatorFactoryTest {

    private static final Instant BASE = Instant.parse("2024-03-01T08:00:00Z");

    private static final Keyset BY_CREATED = Keyset.of(
        List.of(SortKey.desc("created_at"), SortKey.desc("id")),
        List.of(CursorField.of("created_at", KeyType.INSTANT), CursorField.of("id", KeyType.LONG)));

    private PaginatorFactory factory;
    private InMemoryQuerySource source;

    @BeforeEach
    void setUp() {
        factory = new PaginatorFactory(TestCodecs.shared(), PaginationLimits.DEFAULTS, EdgeCursorPolicy.REMINT);
        source = new InMemoryQuerySource("items", "created_at", "id", "status");
        for (long id = 1; id <= 45; id++) {
            source.add(row("created_at", BASE.plusSeconds(id / 3), "id", id, "status", id % 5 == 0 ? "open" : "closed"));
        }
    }

    @Nested
    @DisplayName("configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Should reject a keyset whose cursor fields the source does not expose")
        void shouldRejectUnknownCursorField() {
            InMemoryQuerySource narrow = new InMemoryQuerySource("narrow", "id");

            var ex = assertThrows(PaginationConfigurationException.class, () -> factory.forSource(narrow, BY_CREATED));
            assertTrue(ex.getMessage().contains("created_at"));
        }

        @Test
        @DisplayName("Should reject an empty raw query")
        void shouldRejectBlankRawSql() {
            RawSqlRunner runner = mock(RawSqlRunner.class);
            RawSqlQuery blank = RawSqlQuery.of("blank", "  ", Map.of());

            assertThrows(PaginationConfigurationException.class,
                () -> factory.forRawSql(runner, blank, BY_CREATED, row -> row));
        }

        @Test
        @DisplayName("Should require every collaborator")
        void shouldRequireCollaborators() {
            assertThrows(NullPointerException.class,
                () -> new PaginatorFactory(null, PaginationLimits.DEFAULTS, EdgeCursorPolicy.REMINT));
            assertThrows(NullPointerException.class,
                () -> new PaginatorFactory(TestCodecs.shared(), PaginationLimits.DEFAULTS, null));
        }
    }

    @Test
    @DisplayName("Should report a tampered cursor as a failure value rather than an exception")
    void shouldReturnCursorFailure() {
        Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

        var result = paginator.findNextPage("not-a-real-cursor", Predicate.all());

        assertTrue(result.isFailure());
        assertEquals(CursorError.Invalid.INSTANCE, result.errorOrNull());
        assertEquals(0, source.fetchCount());
    }

    @Test
    @DisplayName("Should use the default limit when none is given")
    void shouldApplyDefaultLimit() {
        Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

        PageResult<Map<String, Object>> page = paginator.findPage(null, RawPageParams.none()).getOrThrow();

        assertEquals(20, page.metadata().limit());
        assertEquals(20, page.metadata().count());
        assertTrue(page.metadata().hasNextPage());
    }

    @Test
    @DisplayName("Should page forward and back through the convenience methods")
    void shouldNavigateWithConvenienceMethods() {
        Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);
        PageResult<Map<String, Object>> first = paginator.findPage(null, RawPageParams.none()).getOrThrow();

        PageResult<Map<String, Object>> second = paginator.findNextPage(first.metadata().nextCursor(), null).getOrThrow();
        PageResult<Map<String, Object>> back = paginator.findPrevPage(second.metadata().prevCursor(), null).getOrThrow();

        assertEquals(20, second.metadata().count());
        assertEquals(first.data(), back.data());
    }

    @Nested
    @DisplayName("stream")
    class StreamTests {

        @Test
        @DisplayName("Should visit every matching row once in batches")
        void shouldStreamAllPages() {
            Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

            List<List<Map<String, Object>>> batches = paginator.stream(Predicate.all(), 10).toList();

            assertEquals(5, batches.size());
            assertEquals(List.of(10, 10, 10, 10, 5), batches.stream().map(List::size).toList());
            assertEquals(45, batches.stream().flatMap(List::stream).map(r -> r.get("id")).collect(Collectors.toSet()).size());
        }

        @Test
        @DisplayName("Should only stream rows matching the filter")
        void shouldStreamFilteredRows() {
            Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

            long open = paginator.stream(Predicate.eq("status", "open"), 4).mapToLong(List::size).sum();

            assertEquals(9, open);
        }

        @Test
        @DisplayName("Should not query until the stream is consumed")
        void shouldBeLazy() {
            Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

            var stream = paginator.stream(Predicate.all(), 10);
            assertEquals(0, source.fetchCount());

            stream.limit(2).forEach(batch -> { });
            assertEquals(2, source.fetchCount());
        }

        @Test
        @DisplayName("Should produce no batches for an empty result")
        void shouldStreamNothing() {
            Paginator<Map<String, Object>> paginator = factory.forSource(source, BY_CREATED);

            assertEquals(0, paginator.stream(Predicate.eq("status", "archived"), 10).count());
        }
    }
}
