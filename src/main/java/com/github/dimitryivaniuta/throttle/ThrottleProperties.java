package com.github.dimitryivaniuta.throttle;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "throttle")
public class ThrottleProperties {
    private boolean enabled = true;

    private double maxRequestsPerSecond = 10;
    // null -> max(1, maxRequestsPerSecond)
    private Double burst;

    // empty -> every method is limited
    private List<String> methods = List.of();

    private IpLookupProperties ipLookup = new IpLookupProperties();
    private boolean ignorePath = false;

    // idle buckets are dropped after this; allow-list entries live this long after registration
    private Duration tokenBucketTtl = Duration.ofHours(1);
    private Duration basicAuthTtl;
    private Duration headerTtl;

    private List<String> basicAuthUsers = List.of();
    private Map<String, List<String>> headers = new LinkedHashMap<>();

    private String message = "You have reached maximum request limit.";
    private String messageContentType = "text/plain; charset=utf-8";
    private int statusCode = 429;

    private Duration sweepInterval = Duration.ofMinutes(1);

    // never limited (health checks, metrics scraping, operator API)
    private List<String> excludePaths = List.of("/actuator/**", "/api/admin/**");

    @Getter
    @Setter
    public static class IpLookupProperties {
        // RemoteAddr | none | any header name (X-Forwarded-For, X-Real-IP, CF-Connecting-IP, ...)
        private String headerName = "RemoteAddr";
        private int indexFromRight = 0;
    }
}
