package com.opsdash.domain.model;

import java.time.Instant;

/**
 * Optional criteria for listing access logs; null fields do not filter.
 * {@code search} matches person name, document and access method, case-insensitively.
 */
public record AccessLogFilter(
    String buildingId,
    String personDocument,
    AccessType accessType,
    AccessResult accessResult,
    String deviceId,
    Instant from,
    Instant to,
    String search
) {
    public static AccessLogFilter none() {
        return new AccessLogFilter(null, null, null, null, null, null, null, null);
    }

    public static AccessLogFilter forBuilding(String buildingId) {
        return new AccessLogFilter(buildingId, null, null, null, null, null, null, null);
    }
}
