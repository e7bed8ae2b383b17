package com.github.dimitryivaniuta.throttle.web;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class ServletThrottleRequestTest {

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldExtractUsernameFromBasicCredentials() {
        assertThat(ServletThrottleRequest.basicAuthUsername(basic("alice:secret"))).contains("alice");
        assertThat(ServletThrottleRequest.basicAuthUsername(basic("bob:pa:ss"))).contains("bob");
        assertThat(ServletThrottleRequest.basicAuthUsername(basic("zoë:x"))).contains("zoë");
        assertThat(ServletThrottleRequest.basicAuthUsername("basic " + basic("carol:x").substring(6))).contains("carol");
    }

    @Test
    void shouldIgnoreOtherSchemesAndMalformedValues() {
        assertThat(ServletThrottleRequest.basicAuthUsername(null)).isEmpty();
        assertThat(ServletThrottleRequest.basicAuthUsername("Bearer abc.def")).isEmpty();
        assertThat(ServletThrottleRequest.basicAuthUsername("Basic ")).isEmpty();
        assertThat(ServletThrottleRequest.basicAuthUsername("Basic %%%not-base64")).isEmpty();
        assertThat(ServletThrottleRequest.basicAuthUsername(basic("no-colon"))).isEmpty();
        assertThat(ServletThrottleRequest.basicAuthUsername(basic(":password-only"))).isEmpty();
    }

    @Test
    void shouldExposeEveryHeaderOccurrence() {
        MockHttpServletRequest raw = new MockHttpServletRequest("GET", "/api/demo/ping");
        raw.setRemoteAddr("10.1.2.3");
        raw.addHeader("X-Forwarded-For", "1.1.1.1, 2.2.2.2");
        raw.addHeader("X-Forwarded-For", "3.3.3.3");
        raw.addHeader("Authorization", basic("alice:secret"));

        ServletThrottleRequest req = new ServletThrottleRequest(raw);

        assertThat(req.headerValues("x-forwarded-for")).containsExactly("1.1.1.1, 2.2.2.2", "3.3.3.3");
        assertThat(req.headerValues("X-Missing")).isEmpty();
        assertThat(req.remoteAddress()).isEqualTo("10.1.2.3");
        assertThat(req.path()).isEqualTo("/api/demo/ping");
        assertThat(req.method()).isEqualTo("GET");
        assertThat(req.basicAuthUsername()).contains("alice");
    }
}
