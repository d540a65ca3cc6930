package com.socialpost.domain.event;

import java.util.UUID;

public record PostLikedEvent(
    UUID aggregateId,
    int version
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.POST_LIKED;
    }

    @Override
    public PostLikedEvent withVersion(int version) {
        return new PostLikedEvent(aggregateId, version);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
