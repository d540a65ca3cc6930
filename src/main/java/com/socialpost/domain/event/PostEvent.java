package com.socialpost.domain.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.UUID;

/**
 * An immutable fact about one post. Events are the only source of write-side state.
 * The {@code type} property is the wire discriminator; {@code version} is the event's
 * position in its post's stream, starting at 0.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PostCreatedEvent.class, name = "PostCreatedEvent"),
    @JsonSubTypes.Type(value = MessageUpdatedEvent.class, name = "MessageUpdatedEvent"),
    @JsonSubTypes.Type(value = PostLikedEvent.class, name = "PostLikedEvent"),
    @JsonSubTypes.Type(value = CommentAddedEvent.class, name = "CommentAddedEvent"),
    @JsonSubTypes.Type(value = CommentUpdatedEvent.class, name = "CommentUpdatedEvent"),
    @JsonSubTypes.Type(value = CommentRemovedEvent.class, name = "CommentRemovedEvent"),
    @JsonSubTypes.Type(value = PostRemovedEvent.class, name = "PostRemovedEvent")
})
public sealed interface PostEvent
    permits PostCreatedEvent,
        MessageUpdatedEvent,
        PostLikedEvent,
        CommentAddedEvent,
        CommentUpdatedEvent,
        CommentRemovedEvent,
        PostRemovedEvent {

    UUID aggregateId();

    int version();

    EventType eventType();

    /**
     * Returns a copy of this event positioned at the given stream version.
     */
    PostEvent withVersion(int version);

    /**
     * Routes this event to the handler overload for its kind.
     */
    void accept(PostEventHandler handler);
}
