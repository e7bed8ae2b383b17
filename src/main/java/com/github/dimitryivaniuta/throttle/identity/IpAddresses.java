package com.github.dimitryivaniuta.throttle.identity;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Address string helpers. Never performs DNS lookups.
 */
public final class IpAddresses {

    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F:.]+$");
    private static final int PREFIX_BYTES = 8;

    private IpAddresses() {}

    /**
     * Drops a port from {@code host:port} or {@code [v6]:port}. Bare IPv6 literals are returned unchanged.
     */
    public static String stripPort(String address) {
        if (address == null) return null;
        String a = address.trim();
        if (a.startsWith("[")) {
            int close = a.indexOf(']');
            return (close > 0) ? a.substring(1, close) : a;
        }
        int first = a.indexOf(':');
        if (first >= 0 && first == a.lastIndexOf(':')) {
            return a.substring(0, first);
        }
        return a;
    }

    /**
     * IPv6 addresses collapse to their /64 network, printed in uncompressed form
     * ({@code 2001:db8:0:1:0:0:0:0}). Anything else is returned as given.
     */
    public static String canonicalize(String address) {
        if (address == null || address.indexOf(':') < 0 || !IPV6_LITERAL.matcher(address).matches()) {
            return address;
        }
        try {
            InetAddress parsed = InetAddress.getByName(address);
            if (!(parsed instanceof Inet6Address)) {
                return parsed.getHostAddress();
            }
            byte[] bytes = parsed.getAddress();
            for (int i = PREFIX_BYTES; i < bytes.length; i++) {
                bytes[i] = 0;
            }
            return InetAddress.getByAddress(bytes).getHostAddress();
        } catch (UnknownHostException ex) {
            // not an address literal after all; use the raw value
            return address;
        }
    }
}
