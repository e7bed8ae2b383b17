package com.github.dimitryivaniuta.throttle.web;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

/**
 * {@link ThrottleRequest} over a servlet request.
 */
public final class ServletThrottleRequest implements ThrottleRequest {

    private static final String BASIC_PREFIX = "Basic ";

    private final HttpServletRequest request;

    public ServletThrottleRequest(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public String remoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public List<String> headerValues(String name) {
        Enumeration<String> values = request.getHeaders(name);
        return (values == null) ? List.of() : Collections.list(values);
    }

    @Override
    public String path() {
        return request.getRequestURI();
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public Optional<String> basicAuthUsername() {
        return basicAuthUsername(request.getHeader(HttpHeaders.AUTHORIZATION));
    }

    /**
     * Username from {@code Basic base64(user:password)}; empty for other schemes or malformed values.
     */
    static Optional<String> basicAuthUsername(String authorization) {
        if (authorization == null || authorization.length() <= BASIC_PREFIX.length()
                || !authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return Optional.empty();
        }

        String decoded;
        try {
            byte[] raw = Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim());
            decoded = new String(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            // not valid base64: the request simply carries no usable principal
            return Optional.empty();
        }

        int colon = decoded.indexOf(':');
        if (colon < 0) return Optional.empty();
        String user = decoded.substring(0, colon);
        return user.isEmpty() ? Optional.empty() : Optional.of(user);
    }
}
