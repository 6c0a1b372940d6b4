package com.opsdash.adapter.in.web;

import com.opsdash.application.port.in.AccessAnalyticsUseCase;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.TimeBucket;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/buildings/{buildingId}/analytics")
@Tag(name = "Analytics", description = "Aggregated access statistics")
public class AnalyticsController {

    private final AccessAnalyticsUseCase analyticsUseCase;

    public AnalyticsController(AccessAnalyticsUseCase analyticsUseCase) {
        this.analyticsUseCase = analyticsUseCase;
    }

    @GetMapping("/access-frequency")
    @Operation(summary = "Access counts per time bucket", description = "Latest bucket first; defaults to the last 7 days")
    public ResponseEntity<?> getAccessFrequency(
            @PathVariable String buildingId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "hour, day or week")
            @RequestParam(required = false) String groupBy,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        return toPageResponse(analyticsUseCase.getAccessFrequency(
            buildingId, from, to, TimeBucket.parse(groupBy), new RawPageParams(cursor, limit, direction)));
    }

    @GetMapping("/top-visitors")
    @Operation(summary = "Most frequent visitors", description = "Persons with more than one granted access; defaults to the last 30 days")
    public ResponseEntity<?> getTopVisitors(
            @PathVariable String buildingId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        return toPageResponse(analyticsUseCase.getTopVisitors(
            buildingId, from, to, new RawPageParams(cursor, limit, direction)));
    }

    private <T> ResponseEntity<?> toPageResponse(Result<PageResult<T>, ListingError> result) {
        if (result.isFailure()) {
            ListingError error = result.errorOrNull();
            return ResponseEntity.badRequest().body(ErrorResponse.of(error.code(), error.message()));
        }
        return ResponseEntity.ok(PageResponse.from(result.getOrThrow(), row -> row));
    }
}
