package com.github.dimitryivaniuta.throttle.metrics;

import com.github.dimitryivaniuta.throttle.limiter.Decision;
import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ThrottleMetrics {

    private final MeterRegistry registry;

    public ThrottleMetrics(MeterRegistry registry, Limiter limiter) {
        this.registry = registry;
        Gauge.builder("throttle_tracked_buckets", limiter, Limiter::trackedBuckets)
                .description("Token buckets currently held in memory")
                .register(registry);
    }

    // ---- Decisions ----
    public void decision(Decision.Outcome outcome) {
        Counter.builder("throttle_decisions_total")
                .tag("outcome", outcome.tag()) // admit | reject | bypass
                .register(registry)
                .increment();
    }

    public void decisionDuration(long nanos) {
        Timer.builder("throttle_decision_duration_seconds")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Sweep ----
    public void swept(long removed) {
        Counter.builder("throttle_swept_entries_total")
                .register(registry)
                .increment(removed);
    }
}
