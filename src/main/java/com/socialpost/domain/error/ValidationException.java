package com.socialpost.domain.error;

/**
 * Raised when a required text value is missing or blank.
 */
public class ValidationException extends BusinessException {

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static ValidationException emptyAuthor() {
        return new ValidationException("POST_AUTHOR_EMPTY", "Post author cannot be empty");
    }

    public static ValidationException emptyMessage() {
        return new ValidationException("POST_MESSAGE_EMPTY", "Post message cannot be empty");
    }

    public static ValidationException emptyComment() {
        return new ValidationException("COMMENT_EMPTY", "Comment cannot be empty");
    }
}
