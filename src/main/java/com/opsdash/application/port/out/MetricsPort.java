package com.opsdash.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementPagesServed(String dataset);

    /**
     * @param reason internal rejection reason, {@code invalid} or {@code expired}
     */
    void incrementCursorRejections(String reason);

    void incrementAccessLogsRecorded();

    <T> T recordPageQuery(String dataset, Supplier<T> operation);
}
