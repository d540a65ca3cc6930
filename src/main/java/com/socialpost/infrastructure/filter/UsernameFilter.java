package com.socialpost.infrastructure.filter;

import com.socialpost.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Establishes the request id and requester for every API call. Mutating requests under
 * {@code /api/} must carry a non-blank {@code X-Username}; reads may be anonymous.
 */
@Component
@Order(1)
public class UsernameFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(UsernameFilter.class);

    public static final String USERNAME_HEADER = "X-Username";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String API_PREFIX = "/api/";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String username = request.getHeader(USERNAME_HEADER);
        boolean anonymous = username == null || username.isBlank();

        if (anonymous && requiresUsername(request)) {
            log.warn("Missing {} header for {} {}", USERNAME_HEADER, request.getMethod(), path);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write(
                "{\"error\":\"UNAUTHORIZED\",\"message\":\"Missing " + USERNAME_HEADER + " header\",\"requestId\":\"" + requestId + "\"}"
            );
            return;
        }

        RequestContext.set(anonymous ? null : username.trim(), requestId);
        log.debug("Request accepted: username={}, requestId={}, path={}", username, requestId, path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean requiresUsername(HttpServletRequest request) {
        return request.getRequestURI().startsWith(API_PREFIX)
            && !HttpMethod.GET.matches(request.getMethod());
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
