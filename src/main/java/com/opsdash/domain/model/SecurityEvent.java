package com.opsdash.domain.model;

import java.time.Instant;
import java.util.UUID;

public record SecurityEvent(
    UUID id,
    String eventType,
    Severity severity,
    String description,
    String buildingId,
    boolean resolved,
    Instant createdAt
) {
}
