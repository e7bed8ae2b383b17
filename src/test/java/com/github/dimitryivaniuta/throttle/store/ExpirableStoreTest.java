package com.github.dimitryivaniuta.throttle.store;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ExpirableStoreTest {

    private final AtomicLong nanos = new AtomicLong(1_000);
    private final Ticker ticker = nanos::get;

    private ExpirableStore<String, String> fixed;
    private ExpirableStore<String, String> sliding;

    @BeforeEach
    void setUp() {
        fixed = new ExpirableStore<>("fixed", Duration.ofSeconds(10), false, ticker, Runnable::run);
        sliding = new ExpirableStore<>("sliding", Duration.ofSeconds(10), true, ticker, Runnable::run);
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void shouldHideEntryOnceItsDeadlinePassed() {
        fixed.set("k", "v");
        advance(Duration.ofSeconds(9));
        assertThat(fixed.get("k")).contains("v");

        advance(Duration.ofSeconds(2));
        assertThat(fixed.get("k")).isEmpty();
        assertThat(fixed.contains("k")).isFalse();
    }

    @Test
    void shouldNotExtendFixedDeadlineOnRead() {
        fixed.set("k", "v");
        advance(Duration.ofSeconds(6));
        assertThat(fixed.get("k")).isPresent();
        advance(Duration.ofSeconds(6));

        assertThat(fixed.get("k")).isEmpty();
    }

    @Test
    void shouldExtendSlidingDeadlineOnEveryRead() {
        sliding.set("k", "v");
        for (int i = 0; i < 5; i++) {
            advance(Duration.ofSeconds(6));
            assertThat(sliding.get("k")).as("read %d", i).contains("v");
        }

        advance(Duration.ofSeconds(11));
        assertThat(sliding.get("k")).isEmpty();
    }

    @Test
    void shouldUseExplicitTtlOverDefault() {
        fixed.set("short", "v", Duration.ofSeconds(1));
        fixed.set("long", "v", Duration.ofSeconds(100));

        advance(Duration.ofSeconds(50));

        assertThat(fixed.get("short")).isEmpty();
        assertThat(fixed.get("long")).contains("v");
    }

    @Test
    void shouldTreatNonPositiveTtlAsNeverExpiring() {
        fixed.set("zero", "v", Duration.ZERO);
        fixed.set("negative", "v", Duration.ofSeconds(-5));
        fixed.set("null", "v", null);

        advance(Duration.ofDays(3650));

        assertThat(fixed.get("zero")).contains("v");
        assertThat(fixed.get("negative")).contains("v");
        assertThat(fixed.get("null")).contains("v");
        assertThat(fixed.entry("zero")).get().extracting(ExpirableEntry::expiresIn).isNull();
    }

    @Test
    void shouldOverwriteValueAndResetDeadline() {
        fixed.set("k", "v1");
        advance(Duration.ofSeconds(8));
        fixed.set("k", "v2");
        advance(Duration.ofSeconds(8));

        assertThat(fixed.get("k")).contains("v2");
    }

    @Test
    void shouldDeleteEntry() {
        fixed.set("k", "v");
        fixed.delete("k");

        assertThat(fixed.get("k")).isEmpty();
        assertThat(fixed.size()).isZero();
    }

    @Test
    void shouldCountOnlyLiveEntries() {
        fixed.set("a", "1", Duration.ofSeconds(1));
        fixed.set("b", "2", Duration.ofSeconds(60));
        fixed.set("c", "3", Duration.ofSeconds(60));
        assertThat(fixed.size()).isEqualTo(3);

        advance(Duration.ofSeconds(30));

        assertThat(fixed.size()).isEqualTo(2);
        assertThat(fixed.keys()).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void sweepShouldPhysicallyRemoveExpiredEntries() {
        fixed.set("a", "1", Duration.ofSeconds(1));
        fixed.set("b", "2", Duration.ofSeconds(1));
        fixed.set("c", "3", Duration.ofMinutes(10));

        advance(Duration.ofMinutes(1));

        assertThat(fixed.sweep()).isEqualTo(2);
        assertThat(fixed.snapshot()).containsOnlyKeys("c");
    }

    @Test
    void computeShouldCreateOnceAndThenReuse() {
        AtomicInteger created = new AtomicInteger();

        String first = sliding.compute("k", () -> "v" + created.incrementAndGet(), v -> v);
        String second = sliding.compute("k", () -> "v" + created.incrementAndGet(), v -> v);

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(created).hasValue(1);
    }

    @Test
    void computeShouldRecreateAfterExpiry() {
        AtomicInteger created = new AtomicInteger();
        sliding.compute("k", () -> "v" + created.incrementAndGet(), v -> v);

        advance(Duration.ofSeconds(11));
        String value = sliding.compute("k", () -> "v" + created.incrementAndGet(), v -> v);

        assertThat(value).isEqualTo("v2");
    }

    @Test
    void computeShouldSlideDeadline() {
        sliding.compute("k", () -> "v", v -> v);
        advance(Duration.ofSeconds(8));
        sliding.compute("k", () -> "other", v -> v);
        advance(Duration.ofSeconds(8));

        assertThat(sliding.entry("k")).get()
                .extracting(ExpirableEntry::value)
                .isEqualTo("v");
    }

    @Test
    void entryShouldNotRefreshSlidingDeadline() {
        sliding.set("k", "v");
        advance(Duration.ofSeconds(6));
        assertThat(sliding.entry("k")).get()
                .extracting(ExpirableEntry::expiresIn)
                .isEqualTo(Duration.ofSeconds(4));

        advance(Duration.ofSeconds(6));
        assertThat(sliding.entry("k")).isEmpty();
    }

    @Test
    void updateShouldRemoveEntryWhenFunctionReturnsNull() {
        fixed.set("k", "v");

        assertThat(fixed.update("k", v -> null)).isEmpty();
        assertThat(fixed.contains("k")).isFalse();
        assertThat(fixed.update("absent", v -> v == null ? "new" : v + "!")).contains("new");
    }

    @Test
    void newDefaultTtlShouldApplyToLaterWrites() {
        fixed.set("old", "v");
        fixed.setDefaultTtl(Duration.ofSeconds(100));
        fixed.set("new", "v");

        advance(Duration.ofSeconds(50));

        assertThat(fixed.get("old")).isEmpty();
        assertThat(fixed.get("new")).contains("v");
        assertThat(fixed.defaultTtl()).isEqualTo(Duration.ofSeconds(100));
    }

    @Test
    void computeShouldSerializeAccessToOneKey() throws Exception {
        ExpirableStore<String, int[]> counters =
                new ExpirableStore<>("counters", Duration.ofMinutes(1), true, ticker, Runnable::run);
        int threads = 8;
        int perThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        // non-atomic increment; only the per-key lock keeps it correct
                        counters.compute("hot", () -> new int[1], c -> c[0]++);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        int total = counters.compute("hot", () -> new int[1], c -> c[0]);
        assertThat(total).isEqualTo(threads * perThread);
        assertThat(counters.keys()).containsExactly("hot");
    }
}
