package com.github.dimitryivaniuta.throttle.exchange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable in-memory request view for callers that do not sit behind a servlet container.
 */
public final class SimpleThrottleRequest implements ThrottleRequest {

    private final String remoteAddress;
    private final String path;
    private final String method;
    private final String basicAuthUsername;
    private final Map<String, List<String>> headers;

    private SimpleThrottleRequest(Builder b) {
        this.remoteAddress = b.remoteAddress;
        this.path = b.path;
        this.method = b.method;
        this.basicAuthUsername = b.basicAuthUsername;

        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        b.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public List<String> headerValues(String name) {
        return headers.getOrDefault(name, List.of());
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public Optional<String> basicAuthUsername() {
        return Optional.ofNullable(basicAuthUsername);
    }

    public static final class Builder {
        private String remoteAddress = "";
        private String path = "/";
        private String method = "GET";
        private String basicAuthUsername;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        private Builder() {}

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(String method) {
            this.method = method.toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder basicAuthUsername(String username) {
            this.basicAuthUsername = username;
            return this;
        }

        /**
         * Appends one occurrence of a header; repeated calls keep arrival order.
         */
        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public SimpleThrottleRequest build() {
            return new SimpleThrottleRequest(this);
        }
    }
}
