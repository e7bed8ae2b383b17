package com.github.dimitryivaniuta.throttle.web;

import com.github.dimitryivaniuta.throttle.identity.IpLookup;
import com.github.dimitryivaniuta.throttle.limiter.Limiter;
import com.github.dimitryivaniuta.throttle.limiter.LimiterSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration of the process-local limiter. Every change is visible to requests evaluated
 * after the call returns.
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/throttle")
public class ThrottleAdminController {

    private final Limiter limiter;

    // ---------- DTOs ----------
    public record SettingsResponse(
            double maxRequestsPerSecond,
            double burst,
            Set<String> methods,
            String ipLookupHeader,
            int ipLookupIndexFromRight,
            boolean ignorePath,
            Duration tokenBucketTtl,   // null = never expires
            Duration basicAuthTtl,
            Duration headerTtl,
            String message,
            String messageContentType,
            int statusCode,
            Set<String> basicAuthUsers,
            Map<String, Set<String>> headers,
            long trackedBuckets
    ) {}

    public record RateRequest(
            @NotNull @Positive Double maxRequestsPerSecond,
            @DecimalMin("1.0") Double burst   // omitted = derive from rate
    ) {}

    public record MethodsRequest(@NotNull List<@NotBlank String> methods) {}

    public record IpLookupRequest(
            @NotBlank @Size(max = 128) String headerName,
            @Min(0) @Max(64) int indexFromRight
    ) {}

    public record UsersRequest(@NotEmpty List<@NotBlank @Size(max = 255) String> users) {}

    public record ValuesRequest(@NotNull List<@NotBlank @Size(max = 1024) String> values) {}

    // omitted field = unchanged, PT0S = never expires
    public record TtlsRequest(Duration tokenBucketTtl, Duration basicAuthTtl, Duration headerTtl) {}

    public record MessageRequest(
            @NotNull @Size(max = 4096) String message,
            @Size(max = 255) String contentType,
            @Min(400) @Max(599) Integer statusCode
    ) {}

    public record SweepResponse(long removed, long trackedBuckets) {}

    // ---------- endpoints ----------

    @GetMapping
    public SettingsResponse settings() {
        return toResponse(limiter.settings());
    }

    @PutMapping("/rate")
    public SettingsResponse setRate(@Valid @RequestBody RateRequest req) {
        limiter.setMax(req.maxRequestsPerSecond()).setBurst(req.burst());
        log.info("Rate set to {} req/s, burst {}", req.maxRequestsPerSecond(), req.burst());
        return settings();
    }

    @PutMapping("/methods")
    public SettingsResponse setMethods(@Valid @RequestBody MethodsRequest req) {
        limiter.setMethods(req.methods());
        log.info("Limited methods set to {}", req.methods().isEmpty() ? "ALL" : req.methods());
        return settings();
    }

    @PutMapping("/ip-lookup")
    public SettingsResponse setIpLookup(@Valid @RequestBody IpLookupRequest req) {
        limiter.setIpLookup(IpLookup.header(req.headerName(), req.indexFromRight()));
        log.info("IP lookup set to {}[{}]", req.headerName(), req.indexFromRight());
        return settings();
    }

    @PostMapping("/basic-auth-users")
    public Set<String> addBasicAuthUsers(@Valid @RequestBody UsersRequest req) {
        limiter.setBasicAuthUsers(req.users());
        log.info("Basic-auth users added: {}", req.users().size());
        return limiter.getBasicAuthUsers();
    }

    @DeleteMapping("/basic-auth-users/{username}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeBasicAuthUser(@PathVariable String username) {
        limiter.removeBasicAuthUsers(List.of(username));
        log.info("Basic-auth user removed");
    }

    @PutMapping("/headers/{name}")
    public Set<String> setHeader(@PathVariable String name, @Valid @RequestBody ValuesRequest req) {
        limiter.setHeader(name, req.values());
        log.info("Header {} registered with {} values", name, req.values().size());
        return limiter.getHeaderEntries(name);
    }

    @PostMapping("/headers/{name}/entries")
    public Set<String> addHeaderEntries(@PathVariable String name, @Valid @RequestBody ValuesRequest req) {
        limiter.setHeaderEntries(name, req.values());
        return limiter.getHeaderEntries(name);
    }

    @DeleteMapping("/headers/{name}/entries")
    public Set<String> removeHeaderEntries(@PathVariable String name, @RequestParam("value") List<String> values) {
        limiter.removeHeaderEntries(name, values);
        return limiter.getHeaderEntries(name);
    }

    @DeleteMapping("/headers/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeHeader(@PathVariable String name) {
        limiter.removeHeader(name);
        log.info("Header {} unregistered", name);
    }

    @PutMapping("/ttls")
    public SettingsResponse setTtls(@RequestBody TtlsRequest req) {
        if (req.tokenBucketTtl() != null) limiter.setTokenBucketTtl(req.tokenBucketTtl());
        if (req.basicAuthTtl() != null) limiter.setBasicAuthTtl(req.basicAuthTtl());
        if (req.headerTtl() != null) limiter.setHeaderTtl(req.headerTtl());
        return settings();
    }

    @PutMapping("/message")
    public SettingsResponse setMessage(@Valid @RequestBody MessageRequest req) {
        limiter.setMessage(req.message());
        if (req.contentType() != null) limiter.setMessageContentType(req.contentType());
        if (req.statusCode() != null) limiter.setStatusCode(req.statusCode());
        return settings();
    }

    @PostMapping("/sweep")
    public SweepResponse sweep() {
        long removed = limiter.sweep();
        return new SweepResponse(removed, limiter.trackedBuckets());
    }

    private SettingsResponse toResponse(LimiterSettings s) {
        return new SettingsResponse(
                s.maxRequestsPerSecond(),
                s.effectiveBurst(),
                s.methods(),
                s.ipLookup().headerName(),
                s.ipLookup().indexFromRight(),
                s.ignorePath(),
                positiveOrNull(s.tokenBucketTtl()),
                positiveOrNull(s.basicAuthTtl()),
                positiveOrNull(s.headerTtl()),
                s.message(),
                s.messageContentType(),
                s.statusCode(),
                limiter.getBasicAuthUsers(),
                limiter.getHeaders(),
                limiter.trackedBuckets()
        );
    }

    private static Duration positiveOrNull(Duration d) {
        return (d == null || d.isZero() || d.isNegative()) ? null : d;
    }
}
