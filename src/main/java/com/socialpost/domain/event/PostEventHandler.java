package com.socialpost.domain.event;

/**
 * One operation per event kind. Adding a kind to {@link PostEvent} breaks every
 * implementation until it handles the new kind.
 */
public interface PostEventHandler {

    void on(PostCreatedEvent event);

    void on(MessageUpdatedEvent event);

    void on(PostLikedEvent event);

    void on(CommentAddedEvent event);

    void on(CommentUpdatedEvent event);

    void on(CommentRemovedEvent event);

    void on(PostRemovedEvent event);
}
