package com.opsdash.application.port.in;

import com.opsdash.domain.error.RecordAccessError;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.NewAccessLog;
import com.opsdash.domain.model.Result;

public interface RecordAccessUseCase {
    Result<AccessLog, RecordAccessError> recordAccess(NewAccessLog request);
}
