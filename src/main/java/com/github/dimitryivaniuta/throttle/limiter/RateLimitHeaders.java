package com.github.dimitryivaniuta.throttle.limiter;

import java.math.BigDecimal;

public final class RateLimitHeaders {
    private RateLimitHeaders() {}

    public static final String LIMIT = "RateLimit-Limit";
    public static final String REMAINING = "RateLimit-Remaining";
    public static final String RESET = "RateLimit-Reset";

    // reject-only
    public static final String X_LIMIT = "X-Rate-Limit-Limit";
    public static final String X_DURATION = "X-Rate-Limit-Duration";
    public static final String X_REQUEST_FORWARDED_FOR = "X-Rate-Limit-Request-Forwarded-For";
    public static final String X_REQUEST_REMOTE_ADDR = "X-Rate-Limit-Request-Remote-Addr";

    /**
     * {@code 5.0 -> "5"}, {@code 0.5 -> "0.5"}.
     */
    public static String formatRate(double rate) {
        if (rate == Math.rint(rate) && Math.abs(rate) < Long.MAX_VALUE) {
            return Long.toString((long) rate);
        }
        return BigDecimal.valueOf(rate).stripTrailingZeros().toPlainString();
    }
}
