package com.opsdash.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Access counts of one building over one time bucket. {@code avgProcessingTimeMs} is null
 * when no access in the bucket reported a processing time.
 */
public record AccessFrequencyBucket(
    Instant timeBucket,
    long accessCount,
    long uniquePersons,
    long grantedCount,
    long deniedCount,
    BigDecimal avgProcessingTimeMs
) {
}
