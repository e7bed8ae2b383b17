package com.github.dimitryivaniuta.throttle.limiter;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;
import com.github.dimitryivaniuta.throttle.exchange.ThrottleResponse;

import java.io.IOException;

/**
 * Produces the response for a rejected request. Called synchronously on the request thread after the
 * rate-limit headers have been set.
 */
@FunctionalInterface
public interface LimitReachedHandler {

    void onLimitReached(ThrottleRequest request, ThrottleResponse response, LimiterSettings settings) throws IOException;
}
