package com.socialpost.infrastructure.metrics;

import com.socialpost.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter eventsAppended;
    private final Counter concurrencyConflicts;
    private final Counter publishFailures;
    private final Counter eventsProjected;
    private final Counter projectionFailures;
    private final Counter consumerErrors;
    private final Timer projectionDuration;

    public AppMetrics(MeterRegistry registry) {
        this.eventsAppended = Counter.builder("post_events_appended_total")
            .description("Total number of events written to the event store")
            .register(registry);

        this.concurrencyConflicts = Counter.builder("post_concurrency_conflicts_total")
            .description("Total number of appends rejected by the version check")
            .register(registry);

        this.publishFailures = Counter.builder("post_publish_failures_total")
            .description("Total number of stored events that could not be published")
            .register(registry);

        this.eventsProjected = Counter.builder("post_events_projected_total")
            .description("Total number of consumed events applied to the read model")
            .register(registry);

        this.projectionFailures = Counter.builder("post_projection_failures_total")
            .description("Total number of consumed messages that failed to project")
            .register(registry);

        this.consumerErrors = Counter.builder("post_consumer_errors_total")
            .description("Total number of failed polls and offset commits in the consumption loop")
            .register(registry);

        this.projectionDuration = Timer.builder("post_projection_duration_seconds")
            .description("Time taken to decode and project one consumed message")
            .register(registry);
    }

    @Override
    public void incrementEventsAppended(int count) {
        eventsAppended.increment(count);
    }

    @Override
    public void incrementConcurrencyConflicts() {
        concurrencyConflicts.increment();
    }

    @Override
    public void incrementPublishFailures() {
        publishFailures.increment();
    }

    @Override
    public void incrementEventsProjected() {
        eventsProjected.increment();
    }

    @Override
    public void incrementProjectionFailures() {
        projectionFailures.increment();
    }

    @Override
    public void incrementConsumerErrors() {
        consumerErrors.increment();
    }

    @Override
    public void recordProjectionDuration(Runnable operation) {
        projectionDuration.record(operation);
    }
}
