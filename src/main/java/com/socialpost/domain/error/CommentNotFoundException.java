package com.socialpost.domain.error;

import java.util.UUID;

public class CommentNotFoundException extends BusinessException {

    public CommentNotFoundException(UUID postId, UUID commentId) {
        super("COMMENT_NOT_FOUND", "Comment " + commentId + " does not exist on post " + postId);
    }
}
