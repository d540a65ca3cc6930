package com.socialpost.domain.model;

import com.socialpost.domain.error.CommentNotFoundException;
import com.socialpost.domain.error.InvalidPostStateException;
import com.socialpost.domain.error.NotAuthorizedException;
import com.socialpost.domain.error.ValidationException;
import com.socialpost.domain.event.CommentAddedEvent;
import com.socialpost.domain.event.CommentRemovedEvent;
import com.socialpost.domain.event.CommentUpdatedEvent;
import com.socialpost.domain.event.MessageUpdatedEvent;
import com.socialpost.domain.event.PostCreatedEvent;
import com.socialpost.domain.event.PostEvent;
import com.socialpost.domain.event.PostEventHandler;
import com.socialpost.domain.event.PostLikedEvent;
import com.socialpost.domain.event.PostRemovedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Event-sourced post and its comments.
 *
 * <p>State is only ever changed by folding events. Command methods validate against the
 * current fold, then raise a single event which is folded and appended to the uncommitted
 * buffer in one step. A failed validation leaves both state and buffer untouched.
 *
 * <p>Instances are short-lived: loaded by replay (or built by the factory), mutated,
 * drained by the save, then discarded.
 */
public class PostAggregate {

    /**
     * Version of a post with no events. Real versions start at 0.
     */
    public static final int NEW_VERSION = -1;

    public static final String AGGREGATE_TYPE = "PostAggregate";

    private final Supplier<UUID> commentIdGenerator;
    private final Fold fold = new Fold();
    private final List<PostEvent> uncommitted = new ArrayList<>();
    private final Map<UUID, Comment> comments = new LinkedHashMap<>();

    private UUID id;
    private int version = NEW_VERSION;
    private boolean active;
    private String author;
    private String message;
    private int likes;

    /**
     * Creates an empty post, ready to be rehydrated with {@link #applyForReplay(PostEvent)}.
     */
    public PostAggregate(Supplier<UUID> commentIdGenerator) {
        this.commentIdGenerator = commentIdGenerator;
    }

    public static PostAggregate create(UUID id, String author, String message, Supplier<UUID> commentIdGenerator) {
        if (isBlank(author)) {
            throw ValidationException.emptyAuthor();
        }
        if (isBlank(message)) {
            throw ValidationException.emptyMessage();
        }
        PostAggregate aggregate = new PostAggregate(commentIdGenerator);
        aggregate.raise(new PostCreatedEvent(id, 0, author, message, Instant.now()));
        return aggregate;
    }

    public void editMessage(String newMessage, String requester) {
        requireActive("edit message");
        if (!author.equals(requester)) {
            throw new NotAuthorizedException("Only the author can edit the message of post " + id);
        }
        if (isBlank(newMessage)) {
            throw ValidationException.emptyMessage();
        }
        raise(new MessageUpdatedEvent(id, nextVersion(), newMessage));
    }

    public void like() {
        requireActive("like");
        raise(new PostLikedEvent(id, nextVersion()));
    }

    public UUID addComment(String comment, String username) {
        requireActive("add comment");
        if (isBlank(comment)) {
            throw ValidationException.emptyComment();
        }
        UUID commentId = commentIdGenerator.get();
        raise(new CommentAddedEvent(id, nextVersion(), commentId, comment, username, Instant.now()));
        return commentId;
    }

    public void editComment(UUID commentId, String comment, String requester) {
        requireActive("edit comment");
        Comment existing = requireComment(commentId);
        if (!existing.isOwnedBy(requester)) {
            throw new NotAuthorizedException("Only the owner can edit comment " + commentId);
        }
        if (isBlank(comment)) {
            throw ValidationException.emptyComment();
        }
        raise(new CommentUpdatedEvent(id, nextVersion(), commentId, comment, requester, Instant.now()));
    }

    public void removeComment(UUID commentId, String requester) {
        Comment existing = requireComment(commentId);
        if (!existing.isOwnedBy(requester)) {
            throw new NotAuthorizedException("Only the owner can remove comment " + commentId);
        }
        raise(new CommentRemovedEvent(id, nextVersion(), commentId));
    }

    public void delete(String requester) {
        requireActive("delete");
        if (!author.equals(requester)) {
            throw new NotAuthorizedException("Only the author can delete post " + id);
        }
        raise(new PostRemovedEvent(id, nextVersion()));
    }

    /**
     * Folds a stored event. Never touches the uncommitted buffer.
     *
     * @throws IllegalStateException if the event does not directly follow the current version
     */
    public void applyForReplay(PostEvent event) {
        if (event.version() != version + 1) {
            throw new IllegalStateException("Out of order event for post " + event.aggregateId()
                + ": expected version " + (version + 1) + " but got " + event.version());
        }
        event.accept(fold);
    }

    /**
     * Returns the buffered events in the order they were raised and empties the buffer.
     */
    public List<PostEvent> drainUncommitted() {
        List<PostEvent> drained = List.copyOf(uncommitted);
        uncommitted.clear();
        return drained;
    }

    public int getUncommittedCount() {
        return uncommitted.size();
    }

    public UUID getId() {
        return id;
    }

    public int getVersion() {
        return version;
    }

    public boolean isActive() {
        return active;
    }

    public String getAuthor() {
        return author;
    }

    public String getMessage() {
        return message;
    }

    public int getLikes() {
        return likes;
    }

    public Map<UUID, Comment> getComments() {
        return Collections.unmodifiableMap(comments);
    }

    public Optional<Comment> findComment(UUID commentId) {
        return Optional.ofNullable(comments.get(commentId));
    }

    private void raise(PostEvent event) {
        event.accept(fold);
        uncommitted.add(event);
    }

    private int nextVersion() {
        return version + 1;
    }

    private void requireActive(String operation) {
        if (!active) {
            throw new InvalidPostStateException(id, operation);
        }
    }

    private Comment requireComment(UUID commentId) {
        Comment comment = comments.get(commentId);
        if (comment == null) {
            throw new CommentNotFoundException(id, commentId);
        }
        return comment;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private final class Fold implements PostEventHandler {

        @Override
        public void on(PostCreatedEvent event) {
            id = event.aggregateId();
            author = event.author();
            message = event.message();
            active = true;
            likes = 0;
            version = event.version();
        }

        @Override
        public void on(MessageUpdatedEvent event) {
            message = event.message();
            version = event.version();
        }

        @Override
        public void on(PostLikedEvent event) {
            likes++;
            version = event.version();
        }

        @Override
        public void on(CommentAddedEvent event) {
            comments.put(event.commentId(), new Comment(event.commentId(), event.username(), event.comment(), false));
            version = event.version();
        }

        @Override
        public void on(CommentUpdatedEvent event) {
            comments.computeIfPresent(event.commentId(), (commentId, comment) -> comment.edit(event.comment()));
            version = event.version();
        }

        @Override
        public void on(CommentRemovedEvent event) {
            comments.remove(event.commentId());
            version = event.version();
        }

        @Override
        public void on(PostRemovedEvent event) {
            active = false;
            version = event.version();
        }
    }
}
