package com.github.dimitryivaniuta.throttle.bucket;

import lombok.Getter;

import java.time.Duration;

/**
 * Per-key token bucket with continuous (lazy) refill.
 *
 * <p>A bucket starts full. Each {@link #tryConsume(long)} first adds {@code elapsedSeconds * refillRatePerSecond}
 * tokens (capped at capacity), then takes one token if at least one is available.
 *
 * <p>Not thread-safe on its own: callers serialize access per key (see
 * {@code ExpirableStore#compute}).
 */
@Getter
public final class TokenBucket {

    /**
     * Reporting window advertised to clients. Refill itself is continuous.
     */
    public static final Duration RESET_WINDOW = Duration.ofSeconds(1);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double capacity;
    private final double refillRatePerSecond;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double capacity, double refillRatePerSecond, long nowNanos) {
        if (!(capacity > 0) || Double.isInfinite(capacity)) {
            throw new IllegalArgumentException("capacity must be a positive finite number: " + capacity);
        }
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refillRatePerSecond must be a positive finite number: " + refillRatePerSecond);
        }
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.tokens = capacity;
        this.lastRefillNanos = nowNanos;
    }

    public ConsumeResult tryConsume(long nowNanos) {
        refill(nowNanos);

        boolean allowed = false;
        if (tokens >= 1.0) {
            tokens -= 1.0;
            allowed = true;
        }

        checkInvariant();
        return new ConsumeResult(allowed, (long) Math.floor(tokens), RESET_WINDOW);
    }

    /**
     * Whole tokens available at {@code nowNanos}, without consuming or mutating state.
     */
    public long available(long nowNanos) {
        return (long) Math.floor(Math.min(capacity, tokens + refillFor(nowNanos)));
    }

    private void refill(long nowNanos) {
        tokens = Math.min(capacity, tokens + refillFor(nowNanos));
        // clock went backwards: keep the later timestamp so elapsed time is never counted twice
        lastRefillNanos = Math.max(lastRefillNanos, nowNanos);
    }

    private double refillFor(long nowNanos) {
        long elapsed = Math.max(0L, nowNanos - lastRefillNanos);
        return (elapsed / NANOS_PER_SECOND) * refillRatePerSecond;
    }

    private void checkInvariant() {
        if (tokens < 0.0 || tokens > capacity || Double.isNaN(tokens)) {
            throw new IllegalStateException(
                    "Token bucket invariant violated: tokens=" + tokens + ", capacity=" + capacity);
        }
    }

    /**
     * Outcome of a single consume attempt.
     *
     * @param remaining whole tokens left after the attempt, never negative
     * @param resetAfter always {@link #RESET_WINDOW}
     */
    public record ConsumeResult(boolean allowed, long remaining, Duration resetAfter) {}
}
