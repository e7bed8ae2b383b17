package com.github.dimitryivaniuta.throttle.limiter;

import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.throttle.bucket.TokenBucket;
import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;
import com.github.dimitryivaniuta.throttle.exchange.ThrottleResponse;
import com.github.dimitryivaniuta.throttle.identity.IdentityResolver;
import com.github.dimitryivaniuta.throttle.identity.IpLookup;
import com.github.dimitryivaniuta.throttle.key.KeyComposer;
import com.github.dimitryivaniuta.throttle.limiter.Decision.Outcome;
import com.github.dimitryivaniuta.throttle.limiter.Decision.ResponseHeader;
import com.github.dimitryivaniuta.throttle.store.ExpirableEntry;
import com.github.dimitryivaniuta.throttle.store.ExpirableStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Per-identity token-bucket admission control.
 *
 * <p>Request flow:
 * <ol>
 *   <li>Method check: with method filtering on, other methods bypass (admitted, no bucket, no headers).</li>
 *   <li>Identity: the address is resolved from {@link IpLookup}; see {@link IdentityResolver}.</li>
 *   <li>Key: {@link KeyComposer} builds the composite key, or signals fail-open bypass.</li>
 *   <li>Bucket: get-or-create plus consume runs atomically for that key in the bucket store.</li>
 *   <li>Headers: {@code RateLimit-*} on admit and reject, {@code X-Rate-Limit-*} on reject only.</li>
 * </ol>
 *
 * <p>Three independent stores back the limiter: token buckets (sliding TTL), basic-auth users and
 * header allow-lists (TTL from the time of registration).
 *
 * <p>Setters may be called while requests are in flight. They swap an immutable {@link LimiterSettings}
 * snapshot and return {@code this} for chaining. Rate and burst changes apply to buckets created afterwards.
 */
@Slf4j
public final class Limiter {

    private final AtomicReference<LimiterSettings> settings;
    private final Ticker ticker;

    private final ExpirableStore<String, TokenBucket> tokenBuckets;
    private final ExpirableStore<String, Boolean> basicAuthUsers;
    private final ExpirableStore<String, Set<String>> headerEntries;

    private final IdentityResolver identityResolver = new IdentityResolver();
    private final KeyComposer keyComposer;

    public Limiter(LimiterSettings initial, Ticker ticker) {
        this(initial, ticker, ForkJoinPool.commonPool());
    }

    Limiter(LimiterSettings initial, Ticker ticker, Executor maintenance) {
        Objects.requireNonNull(initial, "settings must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.settings = new AtomicReference<>(initial);

        this.tokenBuckets = new ExpirableStore<>("token-buckets", initial.tokenBucketTtl(), true, ticker, maintenance);
        this.basicAuthUsers = new ExpirableStore<>("basic-auth-users", initial.basicAuthTtl(), false, ticker, maintenance);
        this.headerEntries = new ExpirableStore<>("header-entries", initial.headerTtl(), false, ticker, maintenance);
        this.keyComposer = new KeyComposer(basicAuthUsers, headerEntries);
    }

    public static Limiter of(double maxRequestsPerSecond) {
        return new Limiter(LimiterSettings.defaults(maxRequestsPerSecond), Ticker.systemTicker());
    }

    public LimiterSettings settings() {
        return settings.get();
    }

    // ---- decisions ----

    public Decision decide(ThrottleRequest request) {
        return decide(request, settings.get());
    }

    /**
     * Decides and applies the outcome: headers are always copied to {@code response}; on rejection the
     * configured {@link LimitReachedHandler} writes the response.
     */
    public Decision handle(ThrottleRequest request, ThrottleResponse response) throws IOException {
        LimiterSettings s = settings.get();
        Decision d = decide(request, s);

        for (ResponseHeader h : d.headers()) {
            response.setHeader(h.name(), h.value());
        }
        if (d.rejected()) {
            s.limitReachedHandler().onLimitReached(request, response, s);
        }
        return d;
    }

    /**
     * Consumes from the bucket of an explicit key, for callers that are not HTTP requests.
     * Keys are joined the same way request dimensions are.
     */
    public Decision limitByKeys(String... keys) {
        LimiterSettings s = settings.get();
        String key = KeyComposer.join(Arrays.asList(keys));
        return consume(key, s, null);
    }

    private Decision decide(ThrottleRequest request, LimiterSettings s) {
        if (!s.limitsMethod(request.method())) {
            log.debug("Method {} is not limited; bypass", request.method());
            return Decision.bypass();
        }

        Optional<String> address = identityResolver.resolve(request, s.ipLookup());
        Optional<String> key = keyComposer.compose(request, address, s.keyPolicy());
        if (key.isEmpty()) {
            log.debug("No address resolved via {}; bypass", s.ipLookup().headerName());
            return Decision.bypass();
        }

        return consume(key.get(), s, request);
    }

    private Decision consume(String key, LimiterSettings s, ThrottleRequest request) {
        long now = ticker.read();
        TokenBucket.ConsumeResult r = tokenBuckets.compute(key, () -> newBucket(key, s, now), b -> b.tryConsume(now));

        String limit = RateLimitHeaders.formatRate(s.maxRequestsPerSecond());
        String reset = Long.toString(r.resetAfter().toSeconds());
        List<ResponseHeader> headers = new ArrayList<>(8);
        headers.add(new ResponseHeader(RateLimitHeaders.LIMIT, limit));
        headers.add(new ResponseHeader(RateLimitHeaders.REMAINING, Long.toString(r.remaining())));
        headers.add(new ResponseHeader(RateLimitHeaders.RESET, reset));

        if (r.allowed()) {
            return new Decision(Outcome.ADMIT, key, r.remaining(), headers);
        }

        headers.add(new ResponseHeader(RateLimitHeaders.X_LIMIT, limit));
        headers.add(new ResponseHeader(RateLimitHeaders.X_DURATION, reset));
        if (request != null) {
            headers.add(new ResponseHeader(RateLimitHeaders.X_REQUEST_FORWARDED_FOR,
                    String.join(", ", request.headerValues(IpLookup.X_FORWARDED_FOR))));
            headers.add(new ResponseHeader(RateLimitHeaders.X_REQUEST_REMOTE_ADDR,
                    Objects.toString(request.remoteAddress(), "")));
        }
        return new Decision(Outcome.REJECT, key, r.remaining(), headers);
    }

    private static TokenBucket newBucket(String key, LimiterSettings s, long now) {
        log.debug("New token bucket for key '{}': capacity {}, {} tokens/s", key, s.effectiveBurst(), s.maxRequestsPerSecond());
        return new TokenBucket(s.effectiveBurst(), s.maxRequestsPerSecond(), now);
    }

    // ---- rate settings ----

    public Limiter setMax(double maxRequestsPerSecond) {
        return mutate(s -> s.withMaxRequestsPerSecond(maxRequestsPerSecond));
    }

    /**
     * @param burst bucket capacity, or {@code null} to derive it from the rate
     */
    public Limiter setBurst(Double burst) {
        return mutate(s -> s.withBurst(burst));
    }

    public Limiter setMethods(Collection<String> methods) {
        return mutate(s -> s.withMethods((methods == null) ? Set.of() : new LinkedHashSet<>(methods)));
    }

    public Limiter setIpLookup(IpLookup ipLookup) {
        return mutate(s -> s.withIpLookup(ipLookup));
    }

    public Limiter setIgnorePath(boolean ignorePath) {
        return mutate(s -> s.withIgnorePath(ignorePath));
    }

    // ---- TTLs ----

    public synchronized Limiter setTokenBucketTtl(Duration ttl) {
        mutate(s -> s.withTokenBucketTtl(ttl));
        tokenBuckets.setDefaultTtl(ttl);
        return this;
    }

    public synchronized Limiter setBasicAuthTtl(Duration ttl) {
        mutate(s -> s.withBasicAuthTtl(ttl));
        basicAuthUsers.setDefaultTtl(ttl);
        return this;
    }

    public synchronized Limiter setHeaderTtl(Duration ttl) {
        mutate(s -> s.withHeaderTtl(ttl));
        headerEntries.setDefaultTtl(ttl);
        return this;
    }

    // ---- rejection ----

    public Limiter setMessage(String message) {
        return mutate(s -> s.withMessage(message));
    }

    public Limiter setMessageContentType(String contentType) {
        return mutate(s -> s.withMessageContentType(contentType));
    }

    public Limiter setStatusCode(int statusCode) {
        return mutate(s -> s.withStatusCode(statusCode));
    }

    /**
     * @param handler custom rejection writer, or {@code null} for the configured message
     */
    public Limiter setLimitReachedHandler(LimitReachedHandler handler) {
        return mutate(s -> s.withLimitReachedHandler(handler));
    }

    // ---- basic-auth allow-list ----

    public Limiter setBasicAuthUsers(Collection<String> users) {
        for (String u : users) {
            if (u != null && !u.isEmpty()) basicAuthUsers.set(u, Boolean.TRUE);
        }
        return this;
    }

    public Limiter removeBasicAuthUsers(Collection<String> users) {
        for (String u : users) {
            if (u != null) basicAuthUsers.delete(u);
        }
        return this;
    }

    public Set<String> getBasicAuthUsers() {
        return Collections.unmodifiableSet(new TreeSet<>(basicAuthUsers.keys()));
    }

    // ---- header allow-list ----

    /**
     * Registers {@code header} with exactly {@code values}. An empty collection removes the registration.
     */
    public Limiter setHeader(String header, Collection<String> values) {
        String name = headerName(header);
        Set<String> clean = cleanValues(values);
        if (clean.isEmpty()) {
            headerEntries.delete(name);
        } else {
            headerEntries.set(name, Collections.unmodifiableSet(clean));
        }
        return this;
    }

    /**
     * Adds values to a header registration, creating it if needed.
     */
    public Limiter setHeaderEntries(String header, Collection<String> values) {
        Set<String> added = cleanValues(values);
        if (added.isEmpty()) return this;

        headerEntries.update(headerName(header), current -> {
            Set<String> next = (current == null) ? new TreeSet<>() : new TreeSet<>(current);
            next.addAll(added);
            return Collections.unmodifiableSet(next);
        });
        return this;
    }

    /**
     * Removes values from a header registration; removing the last value drops the header.
     */
    public Limiter removeHeaderEntries(String header, Collection<String> values) {
        Set<String> removed = cleanValues(values);

        headerEntries.update(headerName(header), current -> {
            if (current == null) return null;
            Set<String> next = new TreeSet<>(current);
            next.removeAll(removed);
            return next.isEmpty() ? null : Collections.unmodifiableSet(next);
        });
        return this;
    }

    public Limiter removeHeader(String header) {
        headerEntries.delete(headerName(header));
        return this;
    }

    public Set<String> getHeaderEntries(String header) {
        return headerEntries.entry(headerName(header))
                .map(ExpirableEntry::value)
                .orElse(Set.of());
    }

    public Map<String, Set<String>> getHeaders() {
        return Collections.unmodifiableMap(new TreeMap<>(headerEntries.snapshot()));
    }

    // ---- buckets ----

    public long trackedBuckets() {
        return tokenBuckets.size();
    }

    /**
     * Looks at a bucket without touching its idle deadline.
     */
    public Optional<ExpirableEntry<String, TokenBucket>> bucket(String key) {
        return tokenBuckets.entry(key);
    }

    /**
     * Drops expired entries from every store.
     *
     * @return number of entries removed
     */
    public long sweep() {
        return tokenBuckets.sweep() + basicAuthUsers.sweep() + headerEntries.sweep();
    }

    private synchronized Limiter mutate(UnaryOperator<LimiterSettings> change) {
        settings.set(change.apply(settings.get()));
        return this;
    }

    private static String headerName(String header) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        return KeyComposer.canonicalHeaderName(header);
    }

    private static Set<String> cleanValues(Collection<String> values) {
        Set<String> out = new TreeSet<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return out;
    }
}
