package com.socialpost.application.query;

public class QueryHandlerNotFoundException extends RuntimeException {

    public QueryHandlerNotFoundException(Class<?> queryType) {
        super("No query handler was registered for " + queryType.getSimpleName());
    }
}
