package com.opsdash.domain.model;

import java.time.Instant;

public record TopVisitor(
    String personDocument,
    String personName,
    long visitCount,
    Instant firstAccess,
    Instant lastAccess,
    long uniqueDays
) {
}
