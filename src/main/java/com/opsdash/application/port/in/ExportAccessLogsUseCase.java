package com.opsdash.application.port.in;

import com.opsdash.domain.error.ListingError;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.AccessLogFilter;
import com.opsdash.domain.model.Result;

import java.util.List;
import java.util.stream.Stream;

public interface ExportAccessLogsUseCase {

    /**
     * Every matching access log in listing order, fetched one page at a time as the
     * stream is consumed. The stream must be consumed or closed by the caller.
     */
    Result<Stream<List<AccessLog>>, ListingError> exportAccessLogs(AccessLogFilter filter);
}
