package com.github.dimitryivaniuta.throttle.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IpAddressesTest {

    @Test
    void stripPortShouldHandleEveryAddressShape() {
        assertThat(IpAddresses.stripPort("192.168.1.10:8080")).isEqualTo("192.168.1.10");
        assertThat(IpAddresses.stripPort("192.168.1.10")).isEqualTo("192.168.1.10");
        assertThat(IpAddresses.stripPort("[::1]:8080")).isEqualTo("::1");
        assertThat(IpAddresses.stripPort("2001:db8::1")).isEqualTo("2001:db8::1");
    }

    @Test
    void canonicalizeShouldLeaveIpv4AndNonAddressesAlone() {
        assertThat(IpAddresses.canonicalize("203.0.113.7")).isEqualTo("203.0.113.7");
        assertThat(IpAddresses.canonicalize("client-42")).isEqualTo("client-42");
        assertThat(IpAddresses.canonicalize("")).isEmpty();
    }

    @Test
    void canonicalizeShouldZeroTheInterfaceIdentifier() {
        assertThat(IpAddresses.canonicalize("2001:DB8:0:1:ffff:0:1:2")).isEqualTo("2001:db8:0:1:0:0:0:0");
        assertThat(IpAddresses.canonicalize("::1")).isEqualTo("0:0:0:0:0:0:0:0");
    }
}
