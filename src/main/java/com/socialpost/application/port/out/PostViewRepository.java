package com.socialpost.application.port.out;

import com.socialpost.domain.readmodel.PostView;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-model posts. Write methods take the version of the event being applied and
 * only change a row whose last applied version is lower, so replays are no-ops.
 * Each returns whether a row was changed.
 */
public interface PostViewRepository {

    boolean create(PostView post, int version);

    boolean updateMessage(UUID postId, String message, int version);

    boolean incrementLikes(UUID postId, int version);

    /**
     * Deletes the post together with its comments.
     */
    boolean delete(UUID postId, int version);

    Optional<PostView> findById(UUID postId);

    List<PostView> listAll();

    List<PostView> listByAuthor(String author);

    List<PostView> listWithComments();

    List<PostView> listWithLikesAtLeast(int numberOfLikes);
}
