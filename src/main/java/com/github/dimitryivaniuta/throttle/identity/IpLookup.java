package com.github.dimitryivaniuta.throttle.identity;

import java.util.Objects;

/**
 * Where the limiting address comes from.
 *
 * <p>{@code headerName} is either {@value #REMOTE_ADDR} (transport peer), {@value #NONE} (address dimension
 * disabled) or the name of a request header. {@code indexFromRight} picks an element of the header's
 * comma-separated values counting from the end, 0 being the last.
 */
public record IpLookup(String headerName, int indexFromRight) {

    public static final String REMOTE_ADDR = "RemoteAddr";
    public static final String NONE = "none";

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";
    public static final String CF_CONNECTING_IP = "CF-Connecting-IP";

    public static final IpLookup REMOTE = new IpLookup(REMOTE_ADDR, 0);
    public static final IpLookup DISABLED = new IpLookup(NONE, 0);

    public IpLookup {
        Objects.requireNonNull(headerName, "headerName must not be null");
        headerName = headerName.trim();
        if (headerName.isEmpty()) {
            throw new IllegalArgumentException("headerName must not be blank");
        }
        if (indexFromRight < 0) {
            throw new IllegalArgumentException("indexFromRight must be >= 0: " + indexFromRight);
        }
    }

    public static IpLookup header(String headerName, int indexFromRight) {
        return new IpLookup(headerName, indexFromRight);
    }

    public boolean isRemoteAddr() {
        return REMOTE_ADDR.equalsIgnoreCase(headerName);
    }

    public boolean isDisabled() {
        return NONE.equalsIgnoreCase(headerName);
    }

    /**
     * True for the well-known proxy headers that carry client addresses.
     */
    public boolean isForwardingHeader() {
        return X_FORWARDED_FOR.equalsIgnoreCase(headerName)
                || X_REAL_IP.equalsIgnoreCase(headerName)
                || CF_CONNECTING_IP.equalsIgnoreCase(headerName);
    }
}
