package com.github.dimitryivaniuta.throttle.limiter;

import com.github.dimitryivaniuta.throttle.identity.IpLookup;
import com.github.dimitryivaniuta.throttle.key.KeyPolicy;
import lombok.With;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of limiter configuration. The {@link Limiter} swaps whole snapshots, so one decision
 * always sees a consistent set of values.
 *
 * @param burst bucket capacity; {@code null} derives {@code max(1, maxRequestsPerSecond)}
 * @param methods upper-case methods subject to limiting; empty limits every method
 * @param tokenBucketTtl idle time after which a bucket is dropped; {@code null} keeps buckets forever
 */
@With
public record LimiterSettings(
        double maxRequestsPerSecond,
        Double burst,
        Set<String> methods,
        IpLookup ipLookup,
        boolean ignorePath,
        Duration tokenBucketTtl,
        Duration basicAuthTtl,
        Duration headerTtl,
        String message,
        String messageContentType,
        int statusCode,
        LimitReachedHandler limitReachedHandler
) {

    public static final String DEFAULT_MESSAGE = "You have reached maximum request limit.";
    public static final String DEFAULT_CONTENT_TYPE = "text/plain; charset=utf-8";
    public static final int DEFAULT_STATUS = 429;

    public LimiterSettings {
        if (!(maxRequestsPerSecond > 0) || Double.isInfinite(maxRequestsPerSecond)) {
            throw new IllegalArgumentException("maxRequestsPerSecond must be a positive finite number: " + maxRequestsPerSecond);
        }
        if (burst != null && (!(burst >= 1) || burst.isInfinite())) {
            throw new IllegalArgumentException("burst must be a finite number >= 1: " + burst);
        }
        if (statusCode < 400 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be an HTTP error status (400..599): " + statusCode);
        }
        methods = normalizeMethods(methods);
        Objects.requireNonNull(ipLookup, "ipLookup must not be null");
        message = (message == null) ? "" : message;
        messageContentType = (messageContentType == null || messageContentType.isBlank())
                ? DEFAULT_CONTENT_TYPE : messageContentType;
        limitReachedHandler = (limitReachedHandler == null) ? MessageLimitReachedHandler.INSTANCE : limitReachedHandler;
    }

    public static LimiterSettings defaults(double maxRequestsPerSecond) {
        return new LimiterSettings(
                maxRequestsPerSecond,
                null,
                Set.of(),
                IpLookup.REMOTE,
                false,
                null,
                null,
                null,
                DEFAULT_MESSAGE,
                DEFAULT_CONTENT_TYPE,
                DEFAULT_STATUS,
                null
        );
    }

    public double effectiveBurst() {
        return (burst != null) ? burst : Math.max(1.0, maxRequestsPerSecond);
    }

    /**
     * False when method filtering is on and {@code method} is not in the set.
     */
    public boolean limitsMethod(String method) {
        return methods.isEmpty() || (method != null && methods.contains(method.toUpperCase(Locale.ROOT)));
    }

    KeyPolicy keyPolicy() {
        return new KeyPolicy(!ipLookup.isDisabled(), !ignorePath, !methods.isEmpty());
    }

    private static Set<String> normalizeMethods(Collection<String> methods) {
        if (methods == null || methods.isEmpty()) return Set.of();
        Set<String> out = new TreeSet<>();
        for (String m : methods) {
            if (m != null && !m.isBlank()) out.add(m.trim().toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }
}
