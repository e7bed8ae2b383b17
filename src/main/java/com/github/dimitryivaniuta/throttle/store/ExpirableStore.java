package com.github.dimitryivaniuta.throttle.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Local key/value store where every entry carries its own time-to-live.
 *
 * <p>Backed by a Caffeine cache with variable expiration:
 * <ul>
 *   <li>{@link #set(Object, Object, Duration)} stores an entry with an explicit TTL,
 *       {@link #set(Object, Object)} uses the store default.</li>
 *   <li>With sliding expiry enabled, every read or {@link #compute} resets the deadline to {@code now + ttl},
 *       so only idle keys are reclaimed.</li>
 *   <li>Expired entries are invisible to readers immediately; physical removal happens during Caffeine's
 *       amortized maintenance or an explicit {@link #sweep()}.</li>
 * </ul>
 *
 * <p>{@link #compute} runs under the per-key lock of the backing map, so a get-or-create followed by a
 * mutation is atomic for one key while different keys proceed in parallel.
 *
 * <p>A TTL that is {@code null}, zero or negative means the entry never expires.
 */
@Slf4j
public final class ExpirableStore<K, V> {

    private static final long NEVER = Long.MAX_VALUE;
    private static final Duration MAX_TTL = Duration.ofNanos(Long.MAX_VALUE);

    private final String name;
    private final Cache<K, Slot<V>> cache;
    private volatile long defaultTtlNanos;

    public ExpirableStore(String name, Duration defaultTtl, boolean slidingExpiry, Ticker ticker) {
        this(name, defaultTtl, slidingExpiry, ticker, ForkJoinPool.commonPool());
    }

    /**
     * @param executor runs Caffeine maintenance and removal notifications; {@code Runnable::run} makes
     *                 cleanup deterministic
     */
    public ExpirableStore(String name, Duration defaultTtl, boolean slidingExpiry, Ticker ticker, Executor executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.defaultTtlNanos = toNanos(defaultTtl);
        this.cache = Caffeine.newBuilder()
                .ticker(Objects.requireNonNull(ticker, "ticker must not be null"))
                .executor(Objects.requireNonNull(executor, "executor must not be null"))
                .expireAfter(new SlotExpiry<K, V>(slidingExpiry))
                .build();
    }

    public Optional<V> get(K key) {
        Slot<V> slot = cache.getIfPresent(key);
        return (slot == null) ? Optional.empty() : Optional.of(slot.value());
    }

    public boolean contains(K key) {
        return cache.policy().getIfPresentQuietly(key) != null;
    }

    /**
     * Reads an entry together with its remaining lifetime without refreshing a sliding deadline.
     */
    public Optional<ExpirableEntry<K, V>> entry(K key) {
        Slot<V> slot = cache.policy().getIfPresentQuietly(key);
        if (slot == null) return Optional.empty();

        Duration expiresIn = (slot.ttlNanos() == NEVER) ? null : cache.policy().expireVariably()
                .flatMap(p -> p.getExpiresAfter(key))
                .orElse(null);
        return Optional.of(new ExpirableEntry<>(key, slot.value(), expiresIn));
    }

    public void set(K key, V value) {
        set(key, value, null, true);
    }

    public void set(K key, V value, Duration ttl) {
        set(key, value, ttl, false);
    }

    private void set(K key, V value, Duration ttl, boolean useDefault) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        long nanos = useDefault ? defaultTtlNanos : toNanos(ttl);
        cache.put(key, new Slot<>(value, nanos));
    }

    public void delete(K key) {
        cache.invalidate(key);
    }

    /**
     * Get-or-create followed by an action on the value, atomically for {@code key}.
     *
     * <p>The factory runs only when the key is absent or expired. The entry deadline is (re)set to the store
     * default TTL on every call.
     *
     * @return whatever {@code action} returned
     */
    public <R> R compute(K key, Supplier<? extends V> factory, Function<? super V, ? extends R> action) {
        Objects.requireNonNull(key, "key must not be null");
        AtomicReference<R> result = new AtomicReference<>();

        cache.asMap().compute(key, (k, current) -> {
            V value = (current != null) ? current.value() : Objects.requireNonNull(factory.get(), "factory returned null");
            result.set(action.apply(value));
            return new Slot<>(value, defaultTtlNanos);
        });

        return result.get();
    }

    /**
     * Remaps the value for {@code key} atomically. The function receives {@code null} when the key is absent
     * and may return {@code null} to delete the entry. A surviving entry gets the store default TTL.
     *
     * @return the new value, or empty if the entry was removed
     */
    public Optional<V> update(K key, UnaryOperator<V> remapping) {
        Objects.requireNonNull(key, "key must not be null");

        Slot<V> slot = cache.asMap().compute(key, (k, current) -> {
            V next = remapping.apply((current == null) ? null : current.value());
            return (next == null) ? null : new Slot<>(next, defaultTtlNanos);
        });

        return (slot == null) ? Optional.empty() : Optional.of(slot.value());
    }

    /**
     * Number of entries that are not expired.
     */
    public long size() {
        cache.cleanUp();
        return cache.asMap().keySet().stream().count();
    }

    public Set<K> keys() {
        Set<K> live = new HashSet<>();
        for (K key : cache.asMap().keySet()) {
            live.add(key);
        }
        return Collections.unmodifiableSet(live);
    }

    /**
     * Copy of the live entries, iteration order unspecified.
     */
    public Map<K, V> snapshot() {
        Map<K, V> copy = new LinkedHashMap<>();
        for (Map.Entry<K, Slot<V>> e : cache.asMap().entrySet()) {
            copy.put(e.getKey(), e.getValue().value());
        }
        return copy;
    }

    /**
     * Physically removes expired entries.
     *
     * @return how many entries were dropped by this pass (approximate under concurrent writes)
     */
    public long sweep() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        long removed = Math.max(0, before - cache.estimatedSize());
        if (removed > 0) {
            log.debug("Store '{}' swept {} expired entries", name, removed);
        }
        return removed;
    }

    public Duration defaultTtl() {
        return (defaultTtlNanos == NEVER) ? null : Duration.ofNanos(defaultTtlNanos);
    }

    /**
     * Applies to entries written after this call; existing deadlines are kept until their next write.
     */
    public void setDefaultTtl(Duration ttl) {
        this.defaultTtlNanos = toNanos(ttl);
    }

    static long toNanos(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return NEVER;
        if (ttl.compareTo(MAX_TTL) >= 0) return NEVER;
        return ttl.toNanos();
    }

    private record Slot<V>(V value, long ttlNanos) {}

    private static final class SlotExpiry<K, V> implements Expiry<K, Slot<V>> {

        private final boolean sliding;

        SlotExpiry(boolean sliding) {
            this.sliding = sliding;
        }

        @Override
        public long expireAfterCreate(K key, Slot<V> slot, long currentTime) {
            return slot.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(K key, Slot<V> slot, long currentTime, long currentDuration) {
            return slot.ttlNanos();
        }

        @Override
        public long expireAfterRead(K key, Slot<V> slot, long currentTime, long currentDuration) {
            return sliding ? slot.ttlNanos() : currentDuration;
        }
    }
}
