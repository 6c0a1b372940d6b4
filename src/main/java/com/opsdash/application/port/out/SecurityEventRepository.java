package com.opsdash.application.port.out;

import com.opsdash.domain.model.SecurityEvent;
import com.opsdash.pagination.exec.QuerySource;

public interface SecurityEventRepository {
    void save(SecurityEvent event);
    long count();
    void deleteAll();
    QuerySource<SecurityEvent> asQuerySource();
}
