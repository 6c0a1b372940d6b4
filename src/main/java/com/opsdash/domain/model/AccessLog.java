package com.opsdash.domain.model;

import com.opsdash.domain.error.ValidationError.AccessLogError;

import java.time.Instant;
import java.util.UUID;

/**
 * One pass through an access point. Append-only; never updated after it is recorded.
 */
public record AccessLog(
    UUID id,
    Instant accessTime,
    String buildingId,
    String personName,
    String personDocument,
    PersonType personType,
    AccessType accessType,
    AccessResult accessResult,
    String accessMethod,
    String deviceId,
    Integer processingTimeMs
) {
    public static final int MAX_DOCUMENT_LENGTH = 64;

    /**
     * Creates an AccessLog, returning a Result for expected validation failures.
     */
    public static Result<AccessLog, AccessLogError> create(UUID id, Instant accessTime, NewAccessLog request) {
        if (request.buildingId() == null || request.buildingId().isBlank()) {
            return Result.failure(AccessLogError.MissingBuilding.INSTANCE);
        }
        if (request.personDocument() == null || request.personDocument().isBlank()) {
            return Result.failure(AccessLogError.MissingPersonDocument.INSTANCE);
        }
        String document = request.personDocument().trim();
        if (document.length() > MAX_DOCUMENT_LENGTH) {
            return Result.failure(new AccessLogError.DocumentTooLong(document.length(), MAX_DOCUMENT_LENGTH));
        }
        if (request.processingTimeMs() != null && request.processingTimeMs() < 0) {
            return Result.failure(new AccessLogError.NegativeProcessingTime(request.processingTimeMs()));
        }
        return Result.success(new AccessLog(
            id,
            accessTime,
            request.buildingId().trim(),
            request.personName(),
            document,
            request.personType() != null ? request.personType() : PersonType.VISITOR,
            request.accessType() != null ? request.accessType() : AccessType.ENTRY,
            request.accessResult() != null ? request.accessResult() : AccessResult.GRANTED,
            request.accessMethod(),
            request.deviceId(),
            request.processingTimeMs()
        ));
    }
}
