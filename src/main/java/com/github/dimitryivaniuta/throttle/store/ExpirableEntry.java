package com.github.dimitryivaniuta.throttle.store;

import java.time.Duration;

/**
 * Read-only view of a live store entry.
 *
 * @param expiresIn remaining lifetime, {@code null} when the entry never expires
 */
public record ExpirableEntry<K, V>(K key, V value, Duration expiresIn) {}
