package com.github.dimitryivaniuta.throttle.limiter;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;
import com.github.dimitryivaniuta.throttle.exchange.ThrottleResponse;

import java.io.IOException;

/**
 * Writes the configured message, content type and status code.
 */
public final class MessageLimitReachedHandler implements LimitReachedHandler {

    public static final MessageLimitReachedHandler INSTANCE = new MessageLimitReachedHandler();

    private MessageLimitReachedHandler() {}

    @Override
    public void onLimitReached(ThrottleRequest request, ThrottleResponse response, LimiterSettings settings) throws IOException {
        response.reject(settings.statusCode(), settings.messageContentType(), settings.message());
    }
}
