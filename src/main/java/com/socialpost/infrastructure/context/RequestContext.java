package com.socialpost.infrastructure.context;

import org.slf4j.MDC;

public final class RequestContext {

    private static final String USERNAME_KEY = "username";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<String> currentUsername = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    /**
     * Binds the request to the current thread. {@code username} is null on anonymous reads.
     */
    public static void set(String username, String requestId) {
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
        if (username != null) {
            currentUsername.set(username);
            MDC.put(USERNAME_KEY, username);
        }
    }

    public static String getUsername() {
        return currentUsername.get();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentUsername.remove();
        currentRequestId.remove();
        MDC.remove(USERNAME_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
