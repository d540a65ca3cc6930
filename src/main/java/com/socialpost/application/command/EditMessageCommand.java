package com.socialpost.application.command;

import java.util.UUID;

public record EditMessageCommand(
    UUID postId,
    String message,
    String username
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
