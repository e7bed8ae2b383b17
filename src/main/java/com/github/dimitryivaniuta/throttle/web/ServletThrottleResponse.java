package com.github.dimitryivaniuta.throttle.web;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleResponse;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link ThrottleResponse} over a servlet response.
 */
public final class ServletThrottleResponse implements ThrottleResponse {

    private final HttpServletResponse response;

    public ServletThrottleResponse(HttpServletResponse response) {
        this.response = response;
    }

    @Override
    public void setHeader(String name, String value) {
        response.setHeader(name, value);
    }

    @Override
    public void reject(int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType(contentType);
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
        response.flushBuffer();
    }
}
