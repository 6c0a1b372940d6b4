package com.opsdash.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.application.port.in.ExportAccessLogsUseCase;
import com.opsdash.application.port.in.ListAccessLogsUseCase;
import com.opsdash.application.port.in.RecordAccessUseCase;
import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.error.RecordAccessError;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.AccessLogFilter;
import com.opsdash.domain.model.AccessResult;
import com.opsdash.domain.model.AccessType;
import com.opsdash.domain.model.NewAccessLog;
import com.opsdash.domain.model.PersonType;
import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Access logs", description = "Building access history")
public class AccessLogController {

    private static final byte[] NEWLINE = "\n".getBytes(StandardCharsets.UTF_8);

    private final ListAccessLogsUseCase listAccessLogsUseCase;
    private final RecordAccessUseCase recordAccessUseCase;
    private final ExportAccessLogsUseCase exportAccessLogsUseCase;
    private final ObjectMapper objectMapper;

    public AccessLogController(
            ListAccessLogsUseCase listAccessLogsUseCase,
            RecordAccessUseCase recordAccessUseCase,
            ExportAccessLogsUseCase exportAccessLogsUseCase,
            ObjectMapper objectMapper) {
        this.listAccessLogsUseCase = listAccessLogsUseCase;
        this.recordAccessUseCase = recordAccessUseCase;
        this.exportAccessLogsUseCase = exportAccessLogsUseCase;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/access-logs")
    @Operation(summary = "List access logs", description = "Newest first, filtered and paged with an opaque cursor")
    public ResponseEntity<?> listAccessLogs(
            @RequestParam(required = false) String buildingId,
            @RequestParam(required = false) String personDocument,
            @Parameter(description = "entry or exit") @RequestParam(required = false) String accessType,
            @Parameter(description = "granted or denied") @RequestParam(required = false) String accessResult,
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "Matches person name, document or access method")
            @RequestParam(required = false) String search,
            @Parameter(description = "Pagination cursor from a previous response")
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Page size, clamped to 1..100")
            @RequestParam(required = false) String limit,
            @Parameter(description = "next or prev") @RequestParam(required = false) String direction,
            @RequestParam(defaultValue = "false") boolean includeTotal) {

        AccessLogFilter filter = new AccessLogFilter(
            buildingId,
            personDocument,
            WebParams.optionalEnum(accessType, AccessType.class, "accessType"),
            WebParams.optionalEnum(accessResult, AccessResult.class, "accessResult"),
            deviceId,
            from,
            to,
            search);
        var result = listAccessLogsUseCase.listAccessLogs(
            filter, new RawPageParams(cursor, limit, direction), includeTotal);
        return toPageResponse(result);
    }

    @GetMapping("/access-logs/person/{personDocument}")
    @Operation(summary = "Access history of one person")
    public ResponseEntity<?> getAccessByPerson(
            @PathVariable String personDocument,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        var result = listAccessLogsUseCase.getAccessByPerson(
            personDocument, new RawPageParams(cursor, limit, direction));
        return toPageResponse(result);
    }

    @GetMapping("/buildings/{buildingId}/access-logs/failed")
    @Operation(summary = "Denied accesses of a building", description = "Within the last `hours` hours (default 24)")
    public ResponseEntity<?> getFailedAccess(
            @PathVariable String buildingId,
            @RequestParam(defaultValue = "24") long hours,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        var result = listAccessLogsUseCase.getFailedAccess(
            buildingId, Duration.ofHours(hours), new RawPageParams(cursor, limit, direction));
        return toPageResponse(result);
    }

    @GetMapping("/buildings/{buildingId}/access-logs/slowest")
    @Operation(summary = "Slowest accesses of a building", description = "Accesses without a processing time come last")
    public ResponseEntity<?> getSlowestAccess(
            @PathVariable String buildingId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String direction) {
        var result = listAccessLogsUseCase.getSlowestAccess(
            buildingId, new RawPageParams(cursor, limit, direction));
        return toPageResponse(result);
    }

    @PostMapping("/access-logs")
    @Operation(summary = "Record an access")
    public ResponseEntity<?> recordAccess(@Valid @RequestBody RecordAccessRequest request) {
        Result<AccessLog, RecordAccessError> result = recordAccessUseCase.recordAccess(request.toNewAccessLog());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(AccessLogResponse.from(result.getOrThrow()))
            : ResponseEntity.badRequest().body(ErrorResponse.of(result.errorOrNull().code(), result.errorOrNull().message()));
    }

    @GetMapping("/access-logs/export")
    @Operation(summary = "Export access logs", description = "All matching access logs, one JSON object per line")
    public ResponseEntity<StreamingResponseBody> exportAccessLogs(
            @RequestParam(required = false) String buildingId,
            @RequestParam(required = false) String accessResult,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        AccessLogFilter filter = new AccessLogFilter(
            buildingId, null, null,
            WebParams.optionalEnum(accessResult, AccessResult.class, "accessResult"),
            null, from, to, null);
        var result = exportAccessLogsUseCase.exportAccessLogs(filter);
        if (result.isFailure()) {
            throw InvalidRequestException.of(result.errorOrNull());
        }

        Stream<List<AccessLog>> pages = result.getOrThrow();
        StreamingResponseBody body = out -> {
            try (pages) {
                writeLines(pages.iterator(), out);
            }
        };
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_NDJSON).body(body);
    }

    private void writeLines(Iterator<List<AccessLog>> pages, OutputStream out) throws IOException {
        while (pages.hasNext()) {
            for (AccessLog accessLog : pages.next()) {
                out.write(objectMapper.writeValueAsBytes(AccessLogResponse.from(accessLog)));
                out.write(NEWLINE);
            }
            out.flush();
        }
    }

    private ResponseEntity<?> toPageResponse(Result<PageResult<AccessLog>, ListingError> result) {
        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), AccessLogResponse::from))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(ListingError error) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(error.code(), error.message()));
    }

    // Presence and document rules live in AccessLog.create; these only cap column widths
    public record RecordAccessRequest(
        Instant accessTime,
        @Size(max = 64) String buildingId,
        @Size(max = 200) String personName,
        String personDocument,
        String personType,
        String accessType,
        String accessResult,
        @Size(max = 50) String accessMethod,
        @Size(max = 64) String deviceId,
        Integer processingTimeMs
    ) {
        NewAccessLog toNewAccessLog() {
            return new NewAccessLog(
                accessTime,
                buildingId,
                personName,
                personDocument,
                WebParams.optionalEnum(personType, PersonType.class, "personType"),
                WebParams.optionalEnum(accessType, AccessType.class, "accessType"),
                WebParams.optionalEnum(accessResult, AccessResult.class, "accessResult"),
                accessMethod,
                deviceId,
                processingTimeMs);
        }
    }

    public record AccessLogResponse(
        UUID id,
        Instant accessTime,
        String buildingId,
        String personName,
        String personDocument,
        String personType,
        String accessType,
        String accessResult,
        String accessMethod,
        String deviceId,
        Integer processingTimeMs
    ) {
        public static AccessLogResponse from(AccessLog accessLog) {
            return new AccessLogResponse(
                accessLog.id(),
                accessLog.accessTime(),
                accessLog.buildingId(),
                accessLog.personName(),
                accessLog.personDocument(),
                accessLog.personType().dbValue(),
                accessLog.accessType().dbValue(),
                accessLog.accessResult().dbValue(),
                accessLog.accessMethod(),
                accessLog.deviceId(),
                accessLog.processingTimeMs());
        }
    }
}
