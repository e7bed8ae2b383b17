package com.github.dimitryivaniuta.throttle.identity;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the address a request is limited by.
 *
 * <p>Header lookups treat all occurrences of the header as one comma-separated list:
 * <pre>
 *   X-Forwarded-For: 1.1.1.1, 2.2.2.2
 *   X-Forwarded-For: 3.3.3.3
 *   -> [1.1.1.1, 2.2.2.2, 3.3.3.3]; indexFromRight=0 -> 3.3.3.3
 * </pre>
 * An empty list or an index past the start resolves to nothing; callers fail open.
 *
 * <p>Values taken from {@code RemoteAddr} or a known forwarding header are canonicalized
 * (see {@link IpAddresses#canonicalize(String)}); other headers are used literally.
 */
public final class IdentityResolver {

    public Optional<String> resolve(ThrottleRequest request, IpLookup lookup) {
        if (lookup == null || lookup.isDisabled()) return Optional.empty();

        if (lookup.isRemoteAddr()) {
            String addr = IpAddresses.stripPort(request.remoteAddress());
            return nonBlank(addr).map(IpAddresses::canonicalize);
        }

        List<String> candidates = candidates(request.headerValues(lookup.headerName()));
        int index = candidates.size() - 1 - lookup.indexFromRight();
        if (index < 0) return Optional.empty();

        Optional<String> picked = nonBlank(candidates.get(index));
        return lookup.isForwardingHeader() ? picked.map(IpAddresses::canonicalize) : picked;
    }

    /**
     * Joins every occurrence, splits on commas and trims each element, keeping order.
     */
    static List<String> candidates(List<String> occurrences) {
        List<String> out = new ArrayList<>();
        if (occurrences == null || occurrences.isEmpty()) return out;

        String joined = String.join(",", occurrences);
        for (String part : joined.split(",", -1)) {
            out.add(part.trim());
        }
        return out;
    }

    private static Optional<String> nonBlank(String v) {
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
    }
}
