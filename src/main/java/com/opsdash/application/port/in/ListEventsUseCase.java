package com.opsdash.application.port.in;

import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.EventFilter;
import com.opsdash.domain.model.Result;
import com.opsdash.domain.model.SecurityEvent;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;

public interface ListEventsUseCase {

    Result<PageResult<SecurityEvent>, ListingError> listEvents(
        EventFilter filter, RawPageParams page, boolean includeTotal);

    /**
     * Unresolved high and critical events, most severe first.
     */
    Result<PageResult<SecurityEvent>, ListingError> getCriticalEvents(String buildingId, RawPageParams page);
}
