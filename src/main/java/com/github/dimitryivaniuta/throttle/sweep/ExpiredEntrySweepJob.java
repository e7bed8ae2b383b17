package com.github.dimitryivaniuta.throttle.sweep;

import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import com.github.dimitryivaniuta.throttle.metrics.ThrottleMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired token buckets and allow-list entries.
 *
 * Expired entries are already invisible to decisions; this only bounds memory for keys that are never
 * touched again. Interval: {@code throttle.sweep-interval}.
 */
@Component
@RequiredArgsConstructor
public class ExpiredEntrySweepJob {

    private static final Logger log = LoggerFactory.getLogger(ExpiredEntrySweepJob.class);

    private final Limiter limiter;
    private final ThrottleMetrics metrics;

    @Scheduled(fixedDelayString = "${throttle.sweep-interval:PT1M}", initialDelayString = "${throttle.sweep-interval:PT1M}")
    public void sweepExpired() {
        long removed = limiter.sweep();
        if (removed > 0) {
            metrics.swept(removed);
            log.info("Rate limiter sweep removed {} expired entries", removed);
        }
    }
}
