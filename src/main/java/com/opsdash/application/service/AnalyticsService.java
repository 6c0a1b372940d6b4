package com.opsdash.application.service;

import com.opsdash.application.port.in.AccessAnalyticsUseCase;
import com.opsdash.application.port.out.MetricsPort;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.AccessFrequencyBucket;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.TimeBucket;
import com.opsdash.domain.model.TopVisitor;
import com.opsdash.pagination.PageOptions;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.Paginator;
import com.opsdash.pagination.PaginatorFactory;
import com.opsdash.pagination.exec.RawRowMapper;
import com.opsdash.pagination.exec.RawSqlQuery;
import com.opsdash.pagination.exec.RawSqlRunner;
import com.opsdash.pagination.keyset.CursorField;
import com.opsdash.pagination.keyset.KeyType;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.params.RawPageParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated access statistics. The aggregations are hand-written SQL paged by the
 * engine on their output columns. Buckets and days are computed in UTC.
 */
@Service
public class AnalyticsService implements AccessAnalyticsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    static final String FREQUENCY_DATASET = "access_frequency";
    static final String TOP_VISITORS_DATASET = "top_visitors";
    static final Duration DEFAULT_FREQUENCY_RANGE = Duration.ofDays(7);
    static final Duration DEFAULT_VISITOR_RANGE = Duration.ofDays(30);

    static final String FREQUENCY_SQL = """
        SELECT date_trunc(:bucketUnit, access_time, 'UTC') AS time_bucket,
               COUNT(*) AS access_count,
               COUNT(DISTINCT person_document) AS unique_persons,
               COUNT(*) FILTER (WHERE access_result = 'granted') AS granted_count,
               COUNT(*) FILTER (WHERE access_result = 'denied') AS denied_count,
               AVG(processing_time) AS avg_processing_time
        FROM access_logs
        WHERE building_id = :buildingId
          AND access_time >= :startDate
          AND access_time <= :endDate
        GROUP BY 1
        """;

    static final String TOP_VISITORS_SQL = """
        SELECT person_document,
               MAX(person_name) AS person_name,
               COUNT(*) AS visit_count,
               MIN(access_time) AS first_access,
               MAX(access_time) AS last_access,
               COUNT(DISTINCT CAST(access_time AT TIME ZONE 'UTC' AS DATE)) AS unique_days
        FROM access_logs
        WHERE building_id = :buildingId
          AND access_result = 'granted'
          AND access_time >= :startDate
          AND access_time <= :endDate
        GROUP BY person_document
        HAVING COUNT(*) > 1
        """;

    static final Keyset FREQUENCY_KEYSET = Keyset.of(
        List.of(SortKey.desc("time_bucket")),
        List.of(CursorField.of("time_bucket", KeyType.INSTANT)));

    static final Keyset TOP_VISITORS_KEYSET = Keyset.of(
        List.of(SortKey.desc("visit_count"), SortKey.desc("person_document")),
        List.of(CursorField.of("visit_count", KeyType.LONG), CursorField.of("person_document", KeyType.STRING)));

    static final RawRowMapper<AccessFrequencyBucket> FREQUENCY_MAPPER = row -> new AccessFrequencyBucket(
        instant(row.get("time_bucket")),
        count(row.get("access_count")),
        count(row.get("unique_persons")),
        count(row.get("granted_count")),
        count(row.get("denied_count")),
        (BigDecimal) KeyType.DECIMAL.normalize(row.get("avg_processing_time"))
    );

    static final RawRowMapper<TopVisitor> TOP_VISITOR_MAPPER = row -> new TopVisitor(
        (String) row.get("person_document"),
        (String) row.get("person_name"),
        count(row.get("visit_count")),
        instant(row.get("first_access")),
        instant(row.get("last_access")),
        count(row.get("unique_days"))
    );

    private final RawSqlRunner rawSqlRunner;
    private final PaginatorFactory paginatorFactory;
    private final Clock clock;
    private final PagedQueries pagedQueries;

    public AnalyticsService(
            RawSqlRunner rawSqlRunner,
            PaginatorFactory paginatorFactory,
            MetricsPort metrics,
            Clock clock) {
        this.rawSqlRunner = rawSqlRunner;
        this.paginatorFactory = paginatorFactory;
        this.clock = clock;
        this.pagedQueries = new PagedQueries(metrics);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<AccessFrequencyBucket>, ListingError> getAccessFrequency(
            String buildingId, Instant from, Instant to, TimeBucket bucket, RawPageParams page) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_FREQUENCY_RANGE);
        var rangeError = AccessLogService.checkRange(start, end);
        if (rangeError != null) {
            return Result.failure(rangeError);
        }
        TimeBucket granularity = bucket != null ? bucket : TimeBucket.HOUR;
        log.debug("Access frequency: building={}, bucket={}, from={}, to={}", buildingId, granularity, start, end);

        RawSqlQuery query = RawSqlQuery.of(FREQUENCY_DATASET, FREQUENCY_SQL, Map.of(
            "bucketUnit", granularity.unit(),
            "buildingId", buildingId,
            "startDate", Timestamp.from(start),
            "endDate", Timestamp.from(end)));
        Paginator<AccessFrequencyBucket> paginator =
            paginatorFactory.forRawSql(rawSqlRunner, query, FREQUENCY_KEYSET, FREQUENCY_MAPPER);
        return pagedQueries.fetch(FREQUENCY_DATASET, paginator, PageOptions.of(null, page));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<TopVisitor>, ListingError> getTopVisitors(
            String buildingId, Instant from, Instant to, RawPageParams page) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_VISITOR_RANGE);
        var rangeError = AccessLogService.checkRange(start, end);
        if (rangeError != null) {
            return Result.failure(rangeError);
        }

        RawSqlQuery query = RawSqlQuery.of(TOP_VISITORS_DATASET, TOP_VISITORS_SQL, Map.of(
            "buildingId", buildingId,
            "startDate", Timestamp.from(start),
            "endDate", Timestamp.from(end)));
        Paginator<TopVisitor> paginator =
            paginatorFactory.forRawSql(rawSqlRunner, query, TOP_VISITORS_KEYSET, TOP_VISITOR_MAPPER);
        return pagedQueries.fetch(TOP_VISITORS_DATASET, paginator, PageOptions.of(null, page));
    }

    private static Instant instant(Object value) {
        return (Instant) KeyType.INSTANT.normalize(value);
    }

    private static long count(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
