package com.socialpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record PostCreatedEvent(
    UUID aggregateId,
    int version,
    String author,
    String message,
    Instant datePosted
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.POST_CREATED;
    }

    @Override
    public PostCreatedEvent withVersion(int version) {
        return new PostCreatedEvent(aggregateId, version, author, message, datePosted);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
