package com.opsdash.application.port.out;

import com.opsdash.domain.model.AccessLog;
import com.opsdash.pagination.exec.QuerySource;

import java.util.Optional;
import java.util.UUID;

public interface AccessLogRepository {
    void save(AccessLog accessLog);
    Optional<AccessLog> findById(UUID id);
    long count();
    void deleteAll();

    /**
     * The access log table as a pageable source; filters address its column names.
     */
    QuerySource<AccessLog> asQuerySource();
}
