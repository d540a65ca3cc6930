package com.socialpost.application.command;

public interface PostCommandHandler {

    void handle(NewPostCommand command);

    void handle(EditMessageCommand command);

    void handle(LikePostCommand command);

    void handle(AddCommentCommand command);

    void handle(EditCommentCommand command);

    void handle(RemoveCommentCommand command);

    void handle(DeletePostCommand command);
}
