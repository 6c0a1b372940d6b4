package com.opsdash.application.service;

import com.opsdash.application.port.in.ExportAccessLogsUseCase;
import com.opsdash.application.port.in.ListAccessLogsUseCase;
import com.opsdash.application.port.in.RecordAccessUseCase;
import com.opsdash.application.port.out.AccessLogRepository;
import com.opsdash.application.port.out.IdGenerator;
import com.opsdash.application.port.out.MetricsPort;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.error.RecordAccessError;
import com.opsdash.domain.error.ValidationError.FilterError;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.AccessLogFilter;
import com.opsdash.domain.model.AccessResult;
import com.opsdash.domain.model.NewAccessLog;
import com.opsdash.domain.model.Result;
import com.opsdash.infrastructure.config.AppProperties;
import com.opsdash.pagination.PageOptions;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.Paginator;
import com.opsdash.pagination.PaginatorFactory;
import com.opsdash.pagination.keyset.CursorField;
import com.opsdash.pagination.keyset.KeyType;
import com.opsdash.pagination.keyset.Keyset;
import com.opsdash.pagination.keyset.SortKey;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.predicate.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class AccessLogService implements ListAccessLogsUseCase, RecordAccessUseCase, ExportAccessLogsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);

    static final String DATASET = "access_logs";
    static final String SLOWEST_DATASET = "access_logs_slowest";
    static final Duration MAX_FAILED_ACCESS_WINDOW = Duration.ofDays(30);

    // Newest first; UUIDv7 ids break ties between accesses of the same instant
    static final Keyset BY_ACCESS_TIME = Keyset.of(
        List.of(SortKey.desc("access_time"), SortKey.desc("id")),
        List.of(CursorField.of("access_time", KeyType.INSTANT), CursorField.of("id", KeyType.UUID)));

    static final Keyset BY_PROCESSING_TIME = Keyset.of(
        List.of(SortKey.desc("processing_time").asNullable(), SortKey.desc("id")),
        List.of(CursorField.of("processing_time", KeyType.LONG), CursorField.of("id", KeyType.UUID)));

    private final AccessLogRepository accessLogRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;
    private final int exportBatchSize;
    private final PagedQueries pagedQueries;
    private final Paginator<AccessLog> byAccessTime;
    private final Paginator<AccessLog> byProcessingTime;

    public AccessLogService(
            AccessLogRepository accessLogRepository,
            PaginatorFactory paginatorFactory,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock,
            AppProperties appProperties) {
        this.accessLogRepository = accessLogRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.exportBatchSize = appProperties.getExport().getBatchSize();
        this.pagedQueries = new PagedQueries(metrics);
        this.byAccessTime = paginatorFactory.forSource(accessLogRepository.asQuerySource(), BY_ACCESS_TIME);
        this.byProcessingTime = paginatorFactory.forSource(accessLogRepository.asQuerySource(), BY_PROCESSING_TIME);
    }

    @Override
    @Transactional
    public Result<AccessLog, RecordAccessError> recordAccess(NewAccessLog request) {
        UUID id = idGenerator.generate();
        Instant accessTime = request.accessTime() != null ? request.accessTime() : clock.instant();

        var created = AccessLog.create(id, accessTime, request);
        if (created.isFailure()) {
            log.warn("Access log validation failed: {}", created.errorOrNull().message());
            return Result.failure(new RecordAccessError.ValidationFailed(created.errorOrNull()));
        }

        AccessLog accessLog = created.getOrThrow();
        accessLogRepository.save(accessLog);
        metrics.incrementAccessLogsRecorded();
        log.info("Access recorded: id={}, building={}, type={}, result={}",
            id, accessLog.buildingId(), accessLog.accessType(), accessLog.accessResult());

        return Result.success(accessLog);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<AccessLog>, ListingError> listAccessLogs(
            AccessLogFilter filter, RawPageParams page, boolean includeTotal) {
        AccessLogFilter criteria = filter != null ? filter : AccessLogFilter.none();
        var rangeError = checkRange(criteria.from(), criteria.to());
        if (rangeError != null) {
            return Result.failure(rangeError);
        }
        return pagedQueries.fetch(DATASET, byAccessTime, new PageOptions(toPredicate(criteria), page, includeTotal));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<AccessLog>, ListingError> getAccessByPerson(String personDocument, RawPageParams page) {
        return pagedQueries.fetch(DATASET, byAccessTime,
            PageOptions.of(Predicate.eq("person_document", personDocument.trim()), page));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<AccessLog>, ListingError> getFailedAccess(
            String buildingId, Duration window, RawPageParams page) {
        if (window.isNegative() || window.isZero() || window.compareTo(MAX_FAILED_ACCESS_WINDOW) > 0) {
            return Result.failure(new ListingError.InvalidFilter(
                new FilterError.InvalidWindow(window.toHours(), MAX_FAILED_ACCESS_WINDOW.toHours())));
        }
        Instant since = clock.instant().minus(window);
        Predicate where = Predicate.and(
            Predicate.eq("building_id", buildingId),
            Predicate.eq("access_result", AccessResult.DENIED.dbValue()),
            Predicate.gte("access_time", since));
        return pagedQueries.fetch(DATASET, byAccessTime, PageOptions.of(where, page));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<AccessLog>, ListingError> getSlowestAccess(String buildingId, RawPageParams page) {
        return pagedQueries.fetch(SLOWEST_DATASET, byProcessingTime,
            PageOptions.of(Predicate.eq("building_id", buildingId), page));
    }

    @Override
    public Result<Stream<List<AccessLog>>, ListingError> exportAccessLogs(AccessLogFilter filter) {
        AccessLogFilter criteria = filter != null ? filter : AccessLogFilter.none();
        var rangeError = checkRange(criteria.from(), criteria.to());
        if (rangeError != null) {
            return Result.failure(rangeError);
        }
        log.info("Access log export started: batchSize={}", exportBatchSize);
        return Result.success(byAccessTime.stream(toPredicate(criteria), exportBatchSize));
    }

    static ListingError checkRange(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            return new ListingError.InvalidFilter(new FilterError.InvalidTimeRange(from, to));
        }
        return null;
    }

    static Predicate toPredicate(AccessLogFilter filter) {
        List<Predicate> terms = new ArrayList<>();
        if (PagedQueries.hasText(filter.buildingId())) {
            terms.add(Predicate.eq("building_id", filter.buildingId().trim()));
        }
        if (PagedQueries.hasText(filter.personDocument())) {
            terms.add(Predicate.eq("person_document", filter.personDocument().trim()));
        }
        if (filter.accessType() != null) {
            terms.add(Predicate.eq("access_type", filter.accessType().dbValue()));
        }
        if (filter.accessResult() != null) {
            terms.add(Predicate.eq("access_result", filter.accessResult().dbValue()));
        }
        if (PagedQueries.hasText(filter.deviceId())) {
            terms.add(Predicate.eq("device_id", filter.deviceId().trim()));
        }
        if (filter.from() != null) {
            terms.add(Predicate.gte("access_time", filter.from()));
        }
        if (filter.to() != null) {
            terms.add(Predicate.lte("access_time", filter.to()));
        }
        if (PagedQueries.hasText(filter.search())) {
            String pattern = PagedQueries.containsPattern(filter.search());
            terms.add(Predicate.or(
                Predicate.iLike("person_name", pattern),
                Predicate.iLike("person_document", pattern),
                Predicate.iLike("access_method", pattern)));
        }
        return Predicate.and(terms);
    }
}
