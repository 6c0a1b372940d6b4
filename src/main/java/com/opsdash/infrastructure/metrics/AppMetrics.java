package com.opsdash.infrastructure.metrics;

import com.opsdash.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter accessLogsRecorded;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.accessLogsRecorded = Counter.builder("access_logs_recorded_total")
            .description("Total number of access logs recorded")
            .register(registry);
    }

    @Override
    public void incrementPagesServed(String dataset) {
        Counter.builder("pages_served_total")
            .description("Total number of pages served")
            .tag("dataset", dataset)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementCursorRejections(String reason) {
        Counter.builder("cursor_rejections_total")
            .description("Total number of rejected pagination cursors")
            .tag("reason", reason)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementAccessLogsRecorded() {
        accessLogsRecorded.increment();
    }

    @Override
    public <T> T recordPageQuery(String dataset, Supplier<T> operation) {
        return Timer.builder("page_query_duration_seconds")
            .description("Time taken to fetch one page, cursor checks included")
            .tag("dataset", dataset)
            .register(registry)
            .record(operation);
    }
}
