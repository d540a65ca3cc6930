package com.socialpost.application.port.out;

import com.socialpost.domain.readmodel.CommentView;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-model comments. Writes are versioned against the owning post, see {@link PostViewRepository}.
 */
public interface CommentViewRepository {

    boolean create(CommentView comment, int version);

    boolean update(UUID postId, UUID commentId, String comment, Instant editDate, int version);

    boolean delete(UUID postId, UUID commentId, int version);

    Optional<CommentView> findById(UUID commentId);
}
