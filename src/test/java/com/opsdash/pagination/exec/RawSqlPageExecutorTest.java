package com.opsdash.pagination.exec;

import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.PaginationConfigurationException;
import com.opsdash.pagination.PaginationQueryException;
import com.opsdash.pagination.cursor.CursorCodec;
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
import com.opsdash.pagination.support.TestCodecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawSqlPageExecutor")
class RawSqlPageExecutorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final String HOURLY_SQL =
        "SELECT date_trunc('hour', access_time) AS time_bucket, COUNT(*) AS access_count "
            + "FROM access_logs WHERE building_id = :buildingId GROUP BY 1";

    private static final Keyset BY_BUCKET = Keyset.of(
        List.of(SortKey.desc("time_bucket")),
        List.of(CursorField.of("time_bucket", KeyType.INSTANT)));

    private final CursorCodec codec = TestCodecs.shared();
    private final ParamsValidator validator = new ParamsValidator(codec, PaginationLimits.DEFAULTS);
    private final RawSqlQuery query = RawSqlQuery.of("hourly_frequency", HOURLY_SQL, Map.of("buildingId", "B1"));

    private HourlyBuckets runner;
    private RawSqlPageExecutor executor;

    @BeforeEach
    void setUp() {
        runner = new HourlyBuckets(48);
        executor = new RawSqlPageExecutor(codec, EdgeCursorPolicy.REMINT);
    }

    @Test
    @DisplayName("Should return two full pages of 24 buckets and then signal the end")
    void shouldPageHourlyBuckets() {
        PageResult<Instant> first = page(null, "next");
        assertEquals(24, first.metadata().count());
        assertTrue(first.metadata().hasNextPage());
        assertEquals(START.plus(47, ChronoUnit.HOURS), first.data().get(0));

        PageResult<Instant> second = page(first.metadata().nextCursor(), "next");
        assertEquals(24, second.metadata().count());
        assertFalse(second.metadata().hasNextPage());
        assertNull(second.metadata().nextCursor());
        assertTrue(second.metadata().hasPrevPage());
        assertEquals(START, second.data().get(second.data().size() - 1));
    }

    @Test
    @DisplayName("Should walk back to the first page from the second")
    void shouldPageBackwards() {
        PageResult<Instant> first = page(null, "next");
        PageResult<Instant> second = page(first.metadata().nextCursor(), "next");

        PageResult<Instant> back = page(second.metadata().prevCursor(), "prev");

        assertEquals(first.data(), back.data());
        assertFalse(back.metadata().hasPrevPage());
    }

    @Test
    @DisplayName("Should wrap the caller query and keep its parameters alongside the generated ones")
    void shouldWrapCallerQuery() {
        page(null, "next");

        assertTrue(runner.lastSql.startsWith("WITH paginated_source AS (\n" + HOURLY_SQL));
        assertTrue(runner.lastSql.endsWith("ORDER BY time_bucket DESC LIMIT :ks_limit"));
        assertEquals("B1", runner.lastParameters.get("buildingId"));
        assertEquals(25, runner.lastParameters.get("ks_limit"));
    }

    @Test
    @DisplayName("Should count the wrapped query when a total is requested")
    void shouldCountWrappedQuery() {
        PaginationParams params = validator.parse(new RawPageParams(null, "24", null)).getOrThrow();

        PageResult<Instant> page = executor.execute(
            runner, query, new QuerySpec(Predicate.all(), BY_BUCKET), params, HourlyBuckets::bucketOf, true).getOrThrow();

        assertEquals(48L, page.metadata().total());
        assertTrue(runner.lastSql.startsWith("WITH paginated_source AS ("));
        assertTrue(runner.lastSql.contains("SELECT COUNT(*) FROM paginated_source"));
    }

    @Test
    @DisplayName("Should fail loudly when a cursor field is not an output column of the query")
    void shouldRejectMissingCursorColumn() {
        Keyset wrong = Keyset.of(
            List.of(SortKey.desc("time_bucket")),
            List.of(CursorField.of("time_bucket", KeyType.INSTANT), CursorField.of("total_accesses", KeyType.LONG)));
        PaginationParams params = PaginationParams.firstPage(10);

        assertThrows(PaginationConfigurationException.class, () -> executor.execute(
            runner, query, new QuerySpec(null, wrong), params, HourlyBuckets::bucketOf, false));
    }

    @Test
    @DisplayName("Should wrap database failures with the query name")
    void shouldWrapFailures() {
        RawSqlRunner failing = new RawSqlRunner() {
            @Override
            public List<Map<String, Object>> queryForRows(String sql, Map<String, Object> parameters) {
                throw new IllegalStateException("relation does not exist");
            }

            @Override
            public long queryForCount(String sql, Map<String, Object> parameters) {
                throw new IllegalStateException("relation does not exist");
            }
        };

        var ex = assertThrows(PaginationQueryException.class, () -> executor.execute(
            failing, query, new QuerySpec(null, BY_BUCKET), PaginationParams.firstPage(5), HourlyBuckets::bucketOf, false));
        assertEquals("hourly_frequency", ex.getDataset());
    }

    private PageResult<Instant> page(String cursor, String direction) {
        PaginationParams params = validator.parse(new RawPageParams(cursor, "24", direction)).getOrThrow();
        return executor.execute(runner, query, new QuerySpec(null, BY_BUCKET), params, HourlyBuckets::bucketOf, false)
            .getOrThrow();
    }

    /**
     * Stands in for the database: evaluates the single keyset comparison the executor
     * generates for a one-column keyset.
     */
    private static class HourlyBuckets implements RawSqlRunner {

        private final List<Map<String, Object>> rows = new ArrayList<>();
        private String lastSql;
        private Map<String, Object> lastParameters;

        HourlyBuckets(int hours) {
            for (int hour = 0; hour < hours; hour++) {
                rows.add(Map.of(
                    "time_bucket", Timestamp.from(START.plus(hour, ChronoUnit.HOURS)),
                    "access_count", (long) hour + 1));
            }
        }

        static Instant bucketOf(Map<String, Object> row) {
            return ((Timestamp) row.get("time_bucket")).toInstant();
        }

        @Override
        public List<Map<String, Object>> queryForRows(String sql, Map<String, Object> parameters) {
            lastSql = sql;
            lastParameters = parameters;
            Timestamp bound = (Timestamp) parameters.get("ks_p0");
            boolean ascending = sql.contains("ORDER BY time_bucket ASC");
            Comparator<Map<String, Object>> byBucket = Comparator.comparing(HourlyBuckets::bucketOf);

            Stream<Map<String, Object>> matching = rows.stream();
            if (bound != null) {
                matching = matching.filter(row -> {
                    int cmp = bucketOf(row).compareTo(bound.toInstant());
                    return ascending ? cmp > 0 : cmp < 0;
                });
            }
            return matching
                .sorted(ascending ? byBucket : byBucket.reversed())
                .limit((Integer) parameters.get("ks_limit"))
                .toList();
        }

        @Override
        public long queryForCount(String sql, Map<String, Object> parameters) {
            lastSql = sql;
            lastParameters = parameters;
            return rows.size();
        }
    }
}
