package com.github.dimitryivaniuta.throttle.exchange;

import java.io.IOException;

/**
 * Response sink the limiter writes headers and rejections to.
 */
public interface ThrottleResponse {

    void setHeader(String name, String value);

    /**
     * Writes a complete rejection: status, content type and body.
     */
    void reject(int status, String contentType, String body) throws IOException;
}
