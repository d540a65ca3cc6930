package com.socialpost.application.command;

import java.util.UUID;

public record AddCommentCommand(
    UUID postId,
    String comment,
    String username
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
