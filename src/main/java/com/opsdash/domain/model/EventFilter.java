package com.opsdash.domain.model;

import java.time.Instant;

public record EventFilter(
    String buildingId,
    String eventType,
    Severity severity,
    Boolean resolved,
    Instant from,
    Instant to
) {
    public static EventFilter none() {
        return new EventFilter(null, null, null, null, null, null);
    }
}
