package com.socialpost.domain.error;

import java.util.UUID;

/**
 * Raised when an operation targets a post that has been removed.
 */
public class InvalidPostStateException extends BusinessException {

    public InvalidPostStateException(UUID postId, String operation) {
        super("POST_INACTIVE", "Cannot " + operation + " on inactive post " + postId);
    }
}
