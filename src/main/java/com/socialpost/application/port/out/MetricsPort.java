package com.socialpost.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementEventsAppended(int count);

    void incrementConcurrencyConflicts();

    void incrementPublishFailures();

    void incrementEventsProjected();

    void incrementProjectionFailures();

    void incrementConsumerErrors();

    void recordProjectionDuration(Runnable operation);
}
