package com.socialpost.domain.event;

import java.util.UUID;

public record PostRemovedEvent(
    UUID aggregateId,
    int version
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.POST_REMOVED;
    }

    @Override
    public PostRemovedEvent withVersion(int version) {
        return new PostRemovedEvent(aggregateId, version);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
