package com.socialpost.application.service;

import com.socialpost.domain.event.PostEvent;

import java.util.List;
import java.util.UUID;

/**
 * Per-post append-only event stream with optimistic concurrency and publish-on-append.
 */
public interface EventStore {

    /**
     * Appends events after the given version, then publishes them in order.
     *
     * @param expectedVersion the last version the caller saw, or
     *        {@link com.socialpost.domain.model.PostAggregate#NEW_VERSION} for a new post
     * @throws com.socialpost.domain.error.ConcurrencyConflictException if the stream moved on; nothing is written
     * @throws PublishFailureException if the events were stored but not all were published
     */
    void append(UUID aggregateId, List<PostEvent> events, int expectedVersion);

    /**
     * @throws com.socialpost.domain.error.AggregateNotFoundException if the post has no events
     */
    List<PostEvent> load(UUID aggregateId);
}
