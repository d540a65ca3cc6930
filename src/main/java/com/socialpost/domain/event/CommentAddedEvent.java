package com.socialpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record CommentAddedEvent(
    UUID aggregateId,
    int version,
    UUID commentId,
    String comment,
    String username,
    Instant commentDate
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.COMMENT_ADDED;
    }

    @Override
    public CommentAddedEvent withVersion(int version) {
        return new CommentAddedEvent(aggregateId, version, commentId, comment, username, commentDate);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
