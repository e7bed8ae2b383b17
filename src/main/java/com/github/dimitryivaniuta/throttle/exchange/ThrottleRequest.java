package com.github.dimitryivaniuta.throttle.exchange;

import java.util.List;
import java.util.Optional;

/**
 * What the limiter reads from an inbound request.
 */
public interface ThrottleRequest {

    /**
     * Transport peer address as reported by the server, possibly with a port.
     */
    String remoteAddress();

    /**
     * Every occurrence of a header, in arrival order. Name lookup is case-insensitive.
     * Returns an empty list when the header is absent.
     */
    List<String> headerValues(String name);

    String path();

    String method();

    /**
     * Username from HTTP basic credentials; the password is never needed.
     */
    Optional<String> basicAuthUsername();
}
