package com.opsdash.domain.model;

import java.time.Instant;

/**
 * Unvalidated input for recording an access. {@code accessTime} defaults to now.
 */
public record NewAccessLog(
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
}
