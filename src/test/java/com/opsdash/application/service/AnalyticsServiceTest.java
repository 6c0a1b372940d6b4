package com.opsdash.application.service;

import com.opsdash.application.port.out.MetricsPort;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.AccessFrequencyBucket;
import com.opsdash.domain.model.TimeBucket;
import com.opsdash.domain.model.TopVisitor;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.PaginatorFactory;
import com.opsdash.pagination.exec.EdgeCursorPolicy;
import com.opsdash.pagination.exec.RawSqlRunner;
import com.opsdash.pagination.params.PaginationLimits;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.support.TestCodecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsService.
 * The database is replaced by a mocked runner returning canned aggregation rows.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsService")
class AnalyticsServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private RawSqlRunner rawSqlRunner;

    @Mock
    private MetricsPort metrics;

    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        lenient().when(metrics.recordPageQuery(anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
        PaginatorFactory factory =
            new PaginatorFactory(TestCodecs.shared(), PaginationLimits.DEFAULTS, EdgeCursorPolicy.REMINT);
        analyticsService = new AnalyticsService(rawSqlRunner, factory, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("getAccessFrequency")
    class AccessFrequencyTests {

        @Test
        @DisplayName("Should default to hourly buckets over the last seven days")
        @SuppressWarnings("unchecked")
        void shouldApplyDefaults() {
            when(rawSqlRunner.queryForRows(anyString(), anyMap())).thenReturn(List.of());

            analyticsService.getAccessFrequency("B1", null, null, null, RawPageParams.none());

            ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(rawSqlRunner).queryForRows(sql.capture(), params.capture());
            assertTrue(sql.getValue().contains(AnalyticsService.FREQUENCY_SQL.strip()));
            assertTrue(sql.getValue().endsWith("ORDER BY time_bucket DESC LIMIT :ks_limit"));
            assertEquals("hour", params.getValue().get("bucketUnit"));
            assertEquals("B1", params.getValue().get("buildingId"));
            assertEquals(Timestamp.from(NOW.minus(Duration.ofDays(7))), params.getValue().get("startDate"));
            assertEquals(Timestamp.from(NOW), params.getValue().get("endDate"));
            assertEquals(21, params.getValue().get("ks_limit"));
        }

        @Test
        @DisplayName("Should map aggregation rows and continue after the last bucket")
        @SuppressWarnings("unchecked")
        void shouldMapRowsAndContinue() {
            Instant h2 = Instant.parse("2024-06-01T11:00:00Z");
            Instant h1 = Instant.parse("2024-06-01T10:00:00Z");
            Instant h0 = Instant.parse("2024-06-01T09:00:00Z");
            when(rawSqlRunner.queryForRows(anyString(), anyMap()))
                .thenReturn(List.of(bucket(h2, 12, null), bucket(h1, 7, new BigDecimal("85.5000")), bucket(h0, 3, null)));

            PageResult<AccessFrequencyBucket> page = analyticsService
                .getAccessFrequency("B1", null, null, TimeBucket.DAY, new RawPageParams(null, "2", null))
                .getOrThrow();

            assertEquals(2, page.metadata().count());
            assertTrue(page.metadata().hasNextPage());
            AccessFrequencyBucket second = page.data().get(1);
            assertEquals(h1, second.timeBucket());
            assertEquals(7, second.accessCount());
            assertEquals(5, second.grantedCount());
            assertEquals(2, second.deniedCount());
            assertEquals(new BigDecimal("85.5000"), second.avgProcessingTimeMs());
            assertNull(page.data().get(0).avgProcessingTimeMs());

            reset(rawSqlRunner);
            when(rawSqlRunner.queryForRows(anyString(), anyMap())).thenReturn(List.of(bucket(h0, 3, null)));
            analyticsService.getAccessFrequency(
                "B1", null, null, TimeBucket.DAY, new RawPageParams(page.metadata().nextCursor(), "2", null));

            ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(rawSqlRunner).queryForRows(anyString(), params.capture());
            assertEquals("day", params.getValue().get("bucketUnit"));
            assertEquals(Timestamp.from(h1), params.getValue().get("ks_p0"));
        }

        @Test
        @DisplayName("Should reject an inverted range without touching the database")
        void shouldRejectInvertedRange() {
            var result = analyticsService.getAccessFrequency(
                "B1", NOW, NOW.minusSeconds(3600), TimeBucket.HOUR, RawPageParams.none());

            assertInstanceOf(ListingError.InvalidFilter.class, result.errorOrNull());
            verifyNoInteractions(rawSqlRunner);
        }
    }

    @Nested
    @DisplayName("getTopVisitors")
    class TopVisitorsTests {

        @Test
        @DisplayName("Should map visitor rows in the order the query returns them")
        void shouldMapVisitors() {
            Instant first = NOW.minus(Duration.ofDays(3));
            when(rawSqlRunner.queryForRows(anyString(), anyMap())).thenReturn(List.of(
                visitor("DOC-B", 9L, first),
                visitor("DOC-A", 9L, first)));

            PageResult<TopVisitor> page =
                analyticsService.getTopVisitors("B1", null, null, RawPageParams.none()).getOrThrow();

            assertEquals(List.of("DOC-B", "DOC-A"), page.data().stream().map(TopVisitor::personDocument).toList());
            TopVisitor top = page.data().get(0);
            assertEquals(9, top.visitCount());
            assertEquals(first, top.firstAccess());
            assertEquals(NOW, top.lastAccess());
            assertEquals(3, top.uniqueDays());
            assertFalse(page.metadata().hasNextPage());
            verify(metrics).incrementPagesServed("top_visitors");
        }

        @Test
        @DisplayName("Should order by visit count then document in the generated query")
        void shouldOrderByKeyset() {
            when(rawSqlRunner.queryForRows(anyString(), anyMap())).thenReturn(List.of());

            analyticsService.getTopVisitors("B1", null, null, RawPageParams.none());

            ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
            verify(rawSqlRunner).queryForRows(sql.capture(), anyMap());
            assertTrue(sql.getValue().contains("HAVING COUNT(*) > 1"));
            assertTrue(sql.getValue().endsWith("ORDER BY visit_count DESC, person_document DESC LIMIT :ks_limit"));
        }
    }

    private static Map<String, Object> bucket(Instant start, long count, BigDecimal avg) {
        Map<String, Object> row = new HashMap<>();
        row.put("time_bucket", Timestamp.from(start));
        row.put("access_count", count);
        row.put("unique_persons", 2L);
        row.put("granted_count", count - 2);
        row.put("denied_count", 2L);
        row.put("avg_processing_time", avg);
        return row;
    }

    private static Map<String, Object> visitor(String document, long visits, Instant firstAccess) {
        return Map.of(
            "person_document", document,
            "person_name", "Visitor " + document,
            "visit_count", visits,
            "first_access", Timestamp.from(firstAccess),
            "last_access", Timestamp.from(NOW),
            "unique_days", 3L);
    }
}
