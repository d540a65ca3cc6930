package com.socialpost.domain.readmodel;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Denormalized post as served to readers. Eventually consistent with the event log.
 */
public record PostView(
    UUID postId,
    String author,
    String message,
    Instant datePosted,
    int likes,
    List<CommentView> comments
) {

    public PostView {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public static PostView created(UUID postId, String author, String message, Instant datePosted) {
        return new PostView(postId, author, message, datePosted, 0, List.of());
    }

    public PostView withComments(List<CommentView> comments) {
        return new PostView(postId, author, message, datePosted, likes, comments);
    }
}
