package com.github.dimitryivaniuta.throttle.limiter;

import java.util.List;

/**
 * Result of one admission check.
 *
 * @param key       composite key of the bucket consulted, {@code null} on bypass
 * @param remaining whole tokens left in the bucket, 0 on bypass
 * @param headers   response headers to propagate, empty on bypass
 */
public record Decision(Outcome outcome, String key, long remaining, List<ResponseHeader> headers) {

    public enum Outcome {
        ADMIT("admit"),
        REJECT("reject"),
        BYPASS("bypass");

        private final String tag;
        Outcome(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public record ResponseHeader(String name, String value) {}

    public Decision {
        headers = List.copyOf(headers);
    }

    public static Decision bypass() {
        return new Decision(Outcome.BYPASS, null, 0, List.of());
    }

    public boolean admitted() {
        return outcome != Outcome.REJECT;
    }

    public boolean rejected() {
        return outcome == Outcome.REJECT;
    }

    public String header(String name) {
        for (ResponseHeader h : headers) {
            if (h.name().equalsIgnoreCase(name)) return h.value();
        }
        return null;
    }
}
