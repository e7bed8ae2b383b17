package com.github.dimitryivaniuta.throttle.sample;

import com.github.dimitryivaniuta.throttle.limiter.Decision;
import com.github.dimitryivaniuta.throttle.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Cheap endpoint behind the rate-limit filter, for trying limits by hand.
 */
@RestController
@RequestMapping("/api/demo")
public class PingController {

    public record PingResponse(String status, String outcome, Long remaining, Instant at) {}

    @GetMapping("/ping")
    public PingResponse ping(HttpServletRequest request) {
        Object attr = request.getAttribute(RequestContextKeys.DECISION_ATTRIBUTE);
        if (attr instanceof Decision d) {
            Long remaining = (d.outcome() == Decision.Outcome.BYPASS) ? null : d.remaining();
            return new PingResponse("ok", d.outcome().tag(), remaining, Instant.now());
        }
        return new PingResponse("ok", "unlimited", null, Instant.now());
    }
}
