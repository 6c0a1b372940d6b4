package com.opsdash.adapter.in.web;

import com.opsdash.application.port.in.ListEventsUseCase;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.EventFilter;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.SecurityEvent;
import com.opsdash.domain.model.Severity;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Security events", description = "Alarms and incidents raised by buildings")
public class EventController {

    private final ListEventsUseCase listEventsUseCase;

    public EventController(ListEventsUseCase listEventsUseCase) {
        this.listEventsUseCase = listEventsUseCase;
    }

    @GetMapping
    @Operation(summary = "List security events", description = "Newest first")
    public ResponseEntity<?> listEvents(
            @RequestParam(required = false) String buildingId,
            @RequestParam(required = false) String eventType,
            @Parameter(description = "low, medium, high or critical")
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction,
            @RequestParam(defaultValue = "false") boolean includeTotal) {

        EventFilter filter = new EventFilter(
            buildingId,
            eventType,
            WebParams.optionalEnum(severity, Severity.class, "severity"),
            resolved,
            from,
            to);
        return toPageResponse(listEventsUseCase.listEvents(
            filter, new RawPageParams(cursor, limit, direction), includeTotal));
    }

    @GetMapping("/critical")
    @Operation(summary = "Unresolved high and critical events", description = "Most severe first, then newest")
    public ResponseEntity<?> getCriticalEvents(
            @RequestParam(required = false) String buildingId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        return toPageResponse(listEventsUseCase.getCriticalEvents(
            buildingId, new RawPageParams(cursor, limit, direction)));
    }

    private ResponseEntity<?> toPageResponse(Result<PageResult<SecurityEvent>, ListingError> result) {
        if (result.isFailure()) {
            ListingError error = result.errorOrNull();
            return ResponseEntity.badRequest().body(ErrorResponse.of(error.code(), error.message()));
        }
        return ResponseEntity.ok(PageResponse.from(result.getOrThrow(), EventResponse::from));
    }

    public record EventResponse(
        UUID id,
        String eventType,
        String severity,
        String description,
        String buildingId,
        boolean resolved,
        Instant createdAt
    ) {
        public static EventResponse from(SecurityEvent event) {
            return new EventResponse(
                event.id(),
                event.eventType(),
                event.severity().dbValue(),
                event.description(),
                event.buildingId(),
                event.resolved(),
                event.createdAt());
        }
    }
}
