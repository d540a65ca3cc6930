package com.socialpost.application.service;

import com.socialpost.application.command.AddCommentCommand;
import com.socialpost.application.command.DeletePostCommand;
import com.socialpost.application.command.EditCommentCommand;
import com.socialpost.application.command.EditMessageCommand;
import com.socialpost.application.command.LikePostCommand;
import com.socialpost.application.command.NewPostCommand;
import com.socialpost.application.command.PostCommand;
import com.socialpost.application.command.PostCommandHandler;
import com.socialpost.application.command.RemoveCommentCommand;
import com.socialpost.application.port.in.SendPostCommandUseCase;
import com.socialpost.domain.model.PostAggregate;
import com.socialpost.domain.model.PostAggregateFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Write-side entry point. Failures from the aggregate or the event store reach the caller unchanged.
 */
@Service
public class PostCommandDispatcher implements SendPostCommandUseCase, PostCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(PostCommandDispatcher.class);

    private final PostEventSourcingHandler eventSourcingHandler;
    private final PostAggregateFactory aggregateFactory;

    public PostCommandDispatcher(PostEventSourcingHandler eventSourcingHandler, PostAggregateFactory aggregateFactory) {
        this.eventSourcingHandler = eventSourcingHandler;
        this.aggregateFactory = aggregateFactory;
    }

    @Override
    public void send(PostCommand command) {
        log.debug("Handling {} for post={}", command.getClass().getSimpleName(), command.postId());
        command.dispatchTo(this);
    }

    @Override
    public void handle(NewPostCommand command) {
        PostAggregate aggregate = aggregateFactory.create(command.postId(), command.author(), command.message());
        eventSourcingHandler.save(aggregate);
        log.info("Post created: post={}, author={}", command.postId(), command.author());
    }

    @Override
    public void handle(EditMessageCommand command) {
        update(command.postId(), post -> post.editMessage(command.message(), command.username()));
    }

    @Override
    public void handle(LikePostCommand command) {
        update(command.postId(), PostAggregate::like);
    }

    @Override
    public void handle(AddCommentCommand command) {
        update(command.postId(), post -> post.addComment(command.comment(), command.username()));
    }

    @Override
    public void handle(EditCommentCommand command) {
        update(command.postId(), post -> post.editComment(command.commentId(), command.comment(), command.username()));
    }

    @Override
    public void handle(RemoveCommentCommand command) {
        update(command.postId(), post -> post.removeComment(command.commentId(), command.username()));
    }

    @Override
    public void handle(DeletePostCommand command) {
        update(command.postId(), post -> post.delete(command.username()));
        log.info("Post deleted: post={}, by={}", command.postId(), command.username());
    }

    private void update(UUID postId, Consumer<PostAggregate> operation) {
        PostAggregate aggregate = eventSourcingHandler.getById(postId);
        operation.accept(aggregate);
        eventSourcingHandler.save(aggregate);
    }
}
