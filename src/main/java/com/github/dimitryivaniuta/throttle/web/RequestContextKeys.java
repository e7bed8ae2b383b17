package com.github.dimitryivaniuta.throttle.web;

public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    // Decision stored by RateLimitFilter for downstream handlers
    public static final String DECISION_ATTRIBUTE = RequestContextKeys.class.getName() + ".decision";
}
