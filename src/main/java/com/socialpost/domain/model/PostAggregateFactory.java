package com.socialpost.domain.model;

import java.util.UUID;

public interface PostAggregateFactory {

    /**
     * Builds a new post whose only buffered event is its creation.
     */
    PostAggregate create(UUID id, String author, String message);
}
