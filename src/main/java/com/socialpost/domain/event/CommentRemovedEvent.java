package com.socialpost.domain.event;

import java.util.UUID;

public record CommentRemovedEvent(
    UUID aggregateId,
    int version,
    UUID commentId
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.COMMENT_REMOVED;
    }

    @Override
    public CommentRemovedEvent withVersion(int version) {
        return new CommentRemovedEvent(aggregateId, version, commentId);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
