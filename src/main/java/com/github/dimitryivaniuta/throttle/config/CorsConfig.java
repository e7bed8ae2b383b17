package com.github.dimitryivaniuta.throttle.config;

import java.util.List;

import com.github.dimitryivaniuta.throttle.limiter.RateLimitHeaders;
import com.github.dimitryivaniuta.throttle.web.RequestContextKeys;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * CORS for browser clients. Runs ahead of the rate-limit filter, so preflight requests never spend tokens,
 * and exposes the rate-limit headers to scripts.
 */
@Configuration
public class CorsConfig {

    @Bean
    FilterRegistrationBean<CorsFilter> corsFilter() {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(List.of("http://localhost:3000"));
        c.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of(
                "Content-Type",
                "Authorization",
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setExposedHeaders(List.of(
                RateLimitHeaders.LIMIT,
                RateLimitHeaders.REMAINING,
                RateLimitHeaders.RESET,
                RateLimitHeaders.X_LIMIT,
                RateLimitHeaders.X_DURATION,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);

        FilterRegistrationBean<CorsFilter> registration = new FilterRegistrationBean<>(new CorsFilter(src));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
