package com.socialpost.application.command;

import java.util.UUID;

public record NewPostCommand(
    UUID postId,
    String author,
    String message
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
