package com.socialpost.domain.event;

import java.util.UUID;

public record MessageUpdatedEvent(
    UUID aggregateId,
    int version,
    String message
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.MESSAGE_UPDATED;
    }

    @Override
    public MessageUpdatedEvent withVersion(int version) {
        return new MessageUpdatedEvent(aggregateId, version, message);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
