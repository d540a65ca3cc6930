package com.socialpost.domain.error;

public class NotAuthorizedException extends BusinessException {

    public NotAuthorizedException(String message) {
        super("NOT_AUTHORIZED", message);
    }
}
