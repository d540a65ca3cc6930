package com.socialpost.application.command;

import java.util.UUID;

public record EditCommentCommand(
    UUID postId,
    UUID commentId,
    String comment,
    String username
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
