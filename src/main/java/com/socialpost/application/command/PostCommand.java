package com.socialpost.application.command;

import java.util.UUID;

/**
 * Closed family of write requests against a single post.
 */
public sealed interface PostCommand
    permits NewPostCommand,
        EditMessageCommand,
        LikePostCommand,
        AddCommentCommand,
        EditCommentCommand,
        RemoveCommentCommand,
        DeletePostCommand {

    UUID postId();

    void dispatchTo(PostCommandHandler handler);
}
