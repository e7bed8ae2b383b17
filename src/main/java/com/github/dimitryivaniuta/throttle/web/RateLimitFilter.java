package com.github.dimitryivaniuta.throttle.web;

import com.github.dimitryivaniuta.throttle.ThrottleProperties;
import com.github.dimitryivaniuta.throttle.limiter.Decision;
import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import com.github.dimitryivaniuta.throttle.metrics.ThrottleMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Servlet adapter around {@link Limiter}:
 * - copies RateLimit-* headers onto every limited response
 * - on rejection lets the limiter's LimitReachedHandler write the response and stops the chain
 * - bypassed and admitted requests continue down the chain
 *
 * Never retries; a rejected client decides when to come back based on the headers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE + 20) // after CorrelationIdFilter, before controllers
public class RateLimitFilter extends OncePerRequestFilter {

    private static final PathMatcher PATHS = new AntPathMatcher();

    private final Limiter limiter;
    private final ThrottleProperties props;
    private final ThrottleMetrics metrics;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!props.isEnabled()) return true;

        List<String> excluded = props.getExcludePaths();
        if (excluded == null || excluded.isEmpty()) return false;

        String path = request.getRequestURI();
        for (String pattern : excluded) {
            if (pattern != null && !pattern.isBlank() && PATHS.match(pattern, path)) return true;
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        long start = System.nanoTime();
        Decision decision = limiter.handle(new ServletThrottleRequest(request), new ServletThrottleResponse(response));
        metrics.decisionDuration(System.nanoTime() - start);
        metrics.decision(decision.outcome());

        if (decision.rejected()) {
            log.debug("Rejected {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            return;
        }

        request.setAttribute(RequestContextKeys.DECISION_ATTRIBUTE, decision);
        filterChain.doFilter(request, response);
    }
}
