package com.socialpost.application.command;

import java.util.UUID;

public record DeletePostCommand(
    UUID postId,
    String username
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
