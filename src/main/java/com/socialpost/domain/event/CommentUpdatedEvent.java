package com.socialpost.domain.event;

import java.time.Instant;
import java.util.UUID;

public record CommentUpdatedEvent(
    UUID aggregateId,
    int version,
    UUID commentId,
    String comment,
    String username,
    Instant editDate
) implements PostEvent {

    @Override
    public EventType eventType() {
        return EventType.COMMENT_UPDATED;
    }

    @Override
    public CommentUpdatedEvent withVersion(int version) {
        return new CommentUpdatedEvent(aggregateId, version, commentId, comment, username, editDate);
    }

    @Override
    public void accept(PostEventHandler handler) {
        handler.on(this);
    }
}
