package com.github.dimitryivaniuta.throttle.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.throttle.ThrottleProperties;
import com.github.dimitryivaniuta.throttle.identity.IpLookup;
import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import com.github.dimitryivaniuta.throttle.limiter.LimiterSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Limiter wiring:
 * - one process-local Limiter built from {@code throttle.*} properties
 * - Caffeine system ticker as the single time source for buckets and store deadlines
 *
 * Allow-lists from properties are seeded once at startup; later changes go through the admin API.
 */
@Slf4j
@Configuration
public class ThrottleConfig {

    @Bean
    public Ticker throttleTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Limiter limiter(ThrottleProperties props, Ticker ticker) {
        LimiterSettings settings = LimiterSettings.defaults(props.getMaxRequestsPerSecond())
                .withBurst(props.getBurst())
                .withMethods(props.getMethods() == null ? null : Set.copyOf(props.getMethods()))
                .withIpLookup(IpLookup.header(props.getIpLookup().getHeaderName(), props.getIpLookup().getIndexFromRight()))
                .withIgnorePath(props.isIgnorePath())
                .withTokenBucketTtl(props.getTokenBucketTtl())
                .withBasicAuthTtl(props.getBasicAuthTtl())
                .withHeaderTtl(props.getHeaderTtl())
                .withMessage(props.getMessage())
                .withMessageContentType(props.getMessageContentType())
                .withStatusCode(props.getStatusCode());

        Limiter limiter = new Limiter(settings, ticker);
        if (props.getBasicAuthUsers() != null) {
            limiter.setBasicAuthUsers(props.getBasicAuthUsers());
        }
        if (props.getHeaders() != null) {
            props.getHeaders().forEach(limiter::setHeader);
        }

        log.info("Rate limiter ready: {} req/s, burst {}, ip lookup {}[{}], methods {}",
                settings.maxRequestsPerSecond(), settings.effectiveBurst(),
                settings.ipLookup().headerName(), settings.ipLookup().indexFromRight(),
                settings.methods().isEmpty() ? "ALL" : settings.methods());
        return limiter;
    }
}
