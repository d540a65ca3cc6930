package com.socialpost.application.query;

public class DuplicateHandlerRegistrationException extends RuntimeException {

    public DuplicateHandlerRegistrationException(Class<?> queryType) {
        super("A query handler is already registered for " + queryType.getSimpleName());
    }
}
