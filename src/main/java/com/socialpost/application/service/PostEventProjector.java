package com.socialpost.application.service;

import com.socialpost.application.port.out.CommentViewRepository;
import com.socialpost.application.port.out.PostViewRepository;
import com.socialpost.domain.event.CommentAddedEvent;
import com.socialpost.domain.event.CommentRemovedEvent;
import com.socialpost.domain.event.CommentUpdatedEvent;
import com.socialpost.domain.event.MessageUpdatedEvent;
import com.socialpost.domain.event.PostCreatedEvent;
import com.socialpost.domain.event.PostEventHandler;
import com.socialpost.domain.event.PostLikedEvent;
import com.socialpost.domain.event.PostRemovedEvent;
import com.socialpost.domain.readmodel.CommentView;
import com.socialpost.domain.readmodel.PostView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies consumed events to the read model, one repository write per event.
 * A write that changes nothing (missing target, or an event already applied) is not an error.
 */
@Component
public class PostEventProjector implements PostEventHandler {

    private static final Logger log = LoggerFactory.getLogger(PostEventProjector.class);

    private final PostViewRepository postRepository;
    private final CommentViewRepository commentRepository;

    public PostEventProjector(PostViewRepository postRepository, CommentViewRepository commentRepository) {
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
    }

    @Override
    public void on(PostCreatedEvent event) {
        PostView post = PostView.created(event.aggregateId(), event.author(), event.message(), event.datePosted());
        report(postRepository.create(post, event.version()), "PostCreated", event.aggregateId(), event.version());
    }

    @Override
    public void on(MessageUpdatedEvent event) {
        boolean applied = postRepository.updateMessage(event.aggregateId(), event.message(), event.version());
        report(applied, "MessageUpdated", event.aggregateId(), event.version());
    }

    @Override
    public void on(PostLikedEvent event) {
        report(postRepository.incrementLikes(event.aggregateId(), event.version()),
            "PostLiked", event.aggregateId(), event.version());
    }

    @Override
    public void on(CommentAddedEvent event) {
        CommentView comment = new CommentView(
            event.commentId(),
            event.aggregateId(),
            event.username(),
            event.comment(),
            event.commentDate(),
            false
        );
        report(commentRepository.create(comment, event.version()), "CommentAdded", event.aggregateId(), event.version());
    }

    @Override
    public void on(CommentUpdatedEvent event) {
        boolean applied = commentRepository.update(
            event.aggregateId(), event.commentId(), event.comment(), event.editDate(), event.version());
        report(applied, "CommentUpdated", event.aggregateId(), event.version());
    }

    @Override
    public void on(CommentRemovedEvent event) {
        boolean applied = commentRepository.delete(event.aggregateId(), event.commentId(), event.version());
        report(applied, "CommentRemoved", event.aggregateId(), event.version());
    }

    @Override
    public void on(PostRemovedEvent event) {
        report(postRepository.delete(event.aggregateId(), event.version()), "PostRemoved", event.aggregateId(), event.version());
    }

    private void report(boolean applied, String kind, Object postId, int version) {
        if (applied) {
            log.debug("Projected {}: post={}, version={}", kind, postId, version);
        } else {
            log.debug("Skipped {}: post={}, version={} (target missing or already applied)", kind, postId, version);
        }
    }
}
