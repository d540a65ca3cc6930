package com.socialpost.domain.error;

import java.util.UUID;

public class AggregateNotFoundException extends BusinessException {

    private final UUID aggregateId;

    public AggregateNotFoundException(UUID aggregateId) {
        super("AGGREGATE_NOT_FOUND", "No events found for post " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
