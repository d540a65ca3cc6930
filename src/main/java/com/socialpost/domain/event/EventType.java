package com.socialpost.domain.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of event kinds and their wire discriminators.
 */
public enum EventType {
    POST_CREATED("PostCreatedEvent"),
    MESSAGE_UPDATED("MessageUpdatedEvent"),
    POST_LIKED("PostLikedEvent"),
    COMMENT_ADDED("CommentAddedEvent"),
    COMMENT_UPDATED("CommentUpdatedEvent"),
    COMMENT_REMOVED("CommentRemovedEvent"),
    POST_REMOVED("PostRemovedEvent");

    private final String discriminator;

    EventType(String discriminator) {
        this.discriminator = discriminator;
    }

    public String discriminator() {
        return discriminator;
    }

    public static Optional<EventType> fromDiscriminator(String discriminator) {
        return Arrays.stream(values())
            .filter(type -> type.discriminator.equals(discriminator))
            .findFirst();
    }
}
