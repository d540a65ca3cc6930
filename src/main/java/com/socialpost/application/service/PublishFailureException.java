package com.socialpost.application.service;

import java.util.UUID;

/**
 * An event was durably stored but the broker did not acknowledge it.
 * The stored stream stays valid; readers catch up once the event is published again.
 */
public class PublishFailureException extends RuntimeException {

    private final UUID aggregateId;
    private final int version;

    public PublishFailureException(UUID aggregateId, int version, Throwable cause) {
        super("Event " + version + " of post " + aggregateId + " was stored but could not be published", cause);
        this.aggregateId = aggregateId;
        this.version = version;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public int getVersion() {
        return version;
    }
}
