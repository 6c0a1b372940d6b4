package com.opsdash.application.port.in;

import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.AccessLogFilter;
import com.opsdash.domain.model.Result;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.RawPageParams;

import java.time.Duration;

public interface ListAccessLogsUseCase {

    Result<PageResult<AccessLog>, ListingError> listAccessLogs(
        AccessLogFilter filter, RawPageParams page, boolean includeTotal);

    Result<PageResult<AccessLog>, ListingError> getAccessByPerson(String personDocument, RawPageParams page);

    /**
     * Denied accesses of one building within {@code window} before now.
     */
    Result<PageResult<AccessLog>, ListingError> getFailedAccess(
        String buildingId, Duration window, RawPageParams page);

    /**
     * Accesses of one building, slowest first; accesses without a processing time come last.
     */
    Result<PageResult<AccessLog>, ListingError> getSlowestAccess(String buildingId, RawPageParams page);
}
