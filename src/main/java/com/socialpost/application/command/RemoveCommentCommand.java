package com.socialpost.application.command;

import java.util.UUID;

public record RemoveCommentCommand(
    UUID postId,
    UUID commentId,
    String username
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
