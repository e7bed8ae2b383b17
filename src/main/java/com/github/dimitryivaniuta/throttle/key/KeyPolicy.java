package com.github.dimitryivaniuta.throttle.key;

/**
 * Which request dimensions take part in the composite key.
 *
 * @param addressRequired an ip lookup is configured, so an unresolved address means fail open
 * @param includePath     path is part of the key
 * @param includeMethod   method filtering is on, so the (already allowed) method is part of the key
 */
public record KeyPolicy(boolean addressRequired, boolean includePath, boolean includeMethod) {}
