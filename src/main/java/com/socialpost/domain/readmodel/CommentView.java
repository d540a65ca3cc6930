package com.socialpost.domain.readmodel;

import java.time.Instant;
import java.util.UUID;

public record CommentView(
    UUID commentId,
    UUID postId,
    String username,
    String comment,
    Instant commentDate,
    boolean edited
) {}
