package com.github.dimitryivaniuta.throttle.sweep;

import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import com.github.dimitryivaniuta.throttle.metrics.ThrottleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpiredEntrySweepJobTest {

    private final Limiter limiter = mock(Limiter.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ExpiredEntrySweepJob job = new ExpiredEntrySweepJob(limiter, new ThrottleMetrics(registry, limiter));

    @Test
    void shouldCountRemovedEntries() {
        when(limiter.sweep()).thenReturn(4L, 0L, 3L);

        job.sweepExpired();
        job.sweepExpired();
        job.sweepExpired();

        verify(limiter, times(3)).sweep();
        assertThat(registry.get("throttle_swept_entries_total").counter().count()).isEqualTo(7.0);
    }

    @Test
    void shouldNotRegisterCounterWhenNothingExpired() {
        when(limiter.sweep()).thenReturn(0L);

        job.sweepExpired();

        assertThat(registry.find("throttle_swept_entries_total").counter()).isNull();
    }
}
