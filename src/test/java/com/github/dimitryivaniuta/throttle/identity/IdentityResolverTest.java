package com.github.dimitryivaniuta.throttle.identity;

import com.github.dimitryivaniuta.throttle.exchange.SimpleThrottleRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityResolverTest {

    private final IdentityResolver resolver = new IdentityResolver();

    private static SimpleThrottleRequest.Builder request() {
        return SimpleThrottleRequest.builder().remoteAddress("10.0.0.9:41234");
    }

    @Test
    void shouldPickXForwardedForElementCountingFromTheRight() {
        SimpleThrottleRequest req = request()
                .header("X-Forwarded-For", "1.1.1.1, 2.2.2.2, 3.3.3.3")
                .build();

        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 0))).contains("3.3.3.3");
        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 1))).contains("2.2.2.2");
        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 2))).contains("1.1.1.1");
        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 5))).isEmpty();
    }

    @Test
    void shouldTreatRepeatedHeaderOccurrencesAsOneList() {
        SimpleThrottleRequest req = request()
                .header("X-Forwarded-For", "1.1.1.1, 2.2.2.2")
                .header("X-Forwarded-For", "3.3.3.3")
                .build();

        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 0))).contains("3.3.3.3");
        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 2))).contains("1.1.1.1");
    }

    @Test
    void shouldMatchHeaderNameCaseInsensitively() {
        SimpleThrottleRequest req = request().header("x-forwarded-for", "4.4.4.4").build();

        assertThat(resolver.resolve(req, IpLookup.header("X-Forwarded-For", 0))).contains("4.4.4.4");
    }

    @Test
    void shouldResolveNothingWhenHeaderMissingOrSelectedElementBlank() {
        assertThat(resolver.resolve(request().build(), IpLookup.header("X-Forwarded-For", 0))).isEmpty();

        SimpleThrottleRequest trailingComma = request().header("X-Forwarded-For", "1.1.1.1, ").build();
        assertThat(resolver.resolve(trailingComma, IpLookup.header("X-Forwarded-For", 0))).isEmpty();
        assertThat(resolver.resolve(trailingComma, IpLookup.header("X-Forwarded-For", 1))).contains("1.1.1.1");
    }

    @Test
    void shouldUseTransportPeerWithoutPort() {
        assertThat(resolver.resolve(request().build(), IpLookup.REMOTE)).contains("10.0.0.9");
        assertThat(resolver.resolve(request().remoteAddress("").build(), IpLookup.REMOTE)).isEmpty();
    }

    @Test
    void shouldCollapseIpv6PeersToTheirNetwork() {
        SimpleThrottleRequest a = request().remoteAddress("[2001:db8:0:1:aaaa:bbbb:cccc:dddd]:443").build();
        SimpleThrottleRequest b = request().remoteAddress("[2001:db8:0:1::7]:443").build();

        assertThat(resolver.resolve(a, IpLookup.REMOTE)).contains("2001:db8:0:1:0:0:0:0");
        assertThat(resolver.resolve(b, IpLookup.REMOTE)).isEqualTo(resolver.resolve(a, IpLookup.REMOTE));
    }

    @Test
    void shouldCanonicalizeForwardingHeadersButNotCustomOnes() {
        SimpleThrottleRequest req = request()
                .header("X-Real-IP", "2001:db8:0:2::1")
                .header("X-Client-Id", "2001:db8:0:2::1")
                .build();

        assertThat(resolver.resolve(req, IpLookup.header("X-Real-IP", 0))).contains("2001:db8:0:2:0:0:0:0");
        assertThat(resolver.resolve(req, IpLookup.header("X-Client-Id", 0))).contains("2001:db8:0:2::1");
    }

    @Test
    void shouldResolveNothingWhenLookupDisabled() {
        assertThat(resolver.resolve(request().build(), IpLookup.DISABLED)).isEmpty();
    }

    @Test
    void candidatesShouldKeepEmptyElementsSoIndexesStayStable() {
        assertThat(IdentityResolver.candidates(List.of("a,,b", " c "))).containsExactly("a", "", "b", "c");
    }
}
