package com.socialpost.application.command;

import java.util.UUID;

public record LikePostCommand(
    UUID postId
) implements PostCommand {

    @Override
    public void dispatchTo(PostCommandHandler handler) {
        handler.handle(this);
    }
}
