package com.opsdash.application.service;

import com.opsdash.application.port.in.ListEventsUseCase;
import com.opsdash.application.port.out.MetricsPort;
import com.opsdash.application.port.out.SecurityEventRepository;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.EventFilter;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.SecurityEvent;
import com.opsdash.domain.model.Severity;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
public class SecurityEventService implements ListEventsUseCase {

    static final String DATASET = "security_events";
    static final String CRITICAL_DATASET = "security_events_critical";

    static final Keyset BY_CREATED_AT = Keyset.of(
        List.of(SortKey.desc("created_at"), SortKey.desc("id")),
        List.of(CursorField.of("created_at", KeyType.INSTANT), CursorField.of("id", KeyType.UUID)));

    static final Keyset BY_SEVERITY = Keyset.of(
        List.of(SortKey.desc("severity_rank"), SortKey.desc("created_at"), SortKey.desc("id")),
        List.of(
            CursorField.of("severity_rank", KeyType.LONG),
            CursorField.of("created_at", KeyType.INSTANT),
            CursorField.of("id", KeyType.UUID)));

    private final PagedQueries pagedQueries;
    private final Paginator<SecurityEvent> byCreatedAt;
    private final Paginator<SecurityEvent> bySeverity;

    public SecurityEventService(
            SecurityEventRepository securityEventRepository,
            PaginatorFactory paginatorFactory,
            MetricsPort metrics) {
        this.pagedQueries = new PagedQueries(metrics);
        this.byCreatedAt = paginatorFactory.forSource(securityEventRepository.asQuerySource(), BY_CREATED_AT);
        this.bySeverity = paginatorFactory.forSource(securityEventRepository.asQuerySource(), BY_SEVERITY);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<SecurityEvent>, ListingError> listEvents(
            EventFilter filter, RawPageParams page, boolean includeTotal) {
        EventFilter criteria = filter != null ? filter : EventFilter.none();
        var rangeError = AccessLogService.checkRange(criteria.from(), criteria.to());
        if (rangeError != null) {
            return Result.failure(rangeError);
        }
        return pagedQueries.fetch(DATASET, byCreatedAt, new PageOptions(toPredicate(criteria), page, includeTotal));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PageResult<SecurityEvent>, ListingError> getCriticalEvents(String buildingId, RawPageParams page) {
        List<Predicate> terms = new ArrayList<>();
        terms.add(Predicate.eq("resolved", false));
        terms.add(Predicate.gte("severity_rank", (long) Severity.HIGH.rank()));
        if (PagedQueries.hasText(buildingId)) {
            terms.add(Predicate.eq("building_id", buildingId.trim()));
        }
        return pagedQueries.fetch(CRITICAL_DATASET, bySeverity, PageOptions.of(Predicate.and(terms), page));
    }

    static Predicate toPredicate(EventFilter filter) {
        List<Predicate> terms = new ArrayList<>();
        if (PagedQueries.hasText(filter.buildingId())) {
            terms.add(Predicate.eq("building_id", filter.buildingId().trim()));
        }
        if (PagedQueries.hasText(filter.eventType())) {
            terms.add(Predicate.eq("event_type", filter.eventType().trim()));
        }
        if (filter.severity() != null) {
            terms.add(Predicate.eq("severity", filter.severity().dbValue()));
        }
        if (filter.resolved() != null) {
            terms.add(Predicate.eq("resolved", filter.resolved()));
        }
        if (filter.from() != null) {
            terms.add(Predicate.gte("created_at", filter.from()));
        }
        if (filter.to() != null) {
            terms.add(Predicate.lte("created_at", filter.to()));
        }
        return Predicate.and(terms);
    }
}
