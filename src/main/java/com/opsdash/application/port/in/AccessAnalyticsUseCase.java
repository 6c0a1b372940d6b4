package com.opsdash.application.port.in;

import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.AccessFrequencyBucket;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.TimeBucket;
import com.opsdash.domain.model.TopVisitor;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;

import java.time.Instant;

public interface AccessAnalyticsUseCase {

    Result<PageResult<AccessFrequencyBucket>, ListingError> getAccessFrequency(
        String buildingId, Instant from, Instant to, TimeBucket bucket, RawPageParams page);

    /**
     * Persons with more than one granted access in the range, most frequent first.
     * A null bound defaults to the last 30 days.
     */
    Result<PageResult<TopVisitor>, ListingError> getTopVisitors(
        String buildingId, Instant from, Instant to, RawPageParams page);
}
