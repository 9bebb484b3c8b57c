package com.nexus.resolution.cache;

import java.time.Duration;

/**
 * Configuration for the resolution cache.
 *
 * @param maxSize maximum number of name entries
 * @param ttl     time-to-live of each entry
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 10,000 entries, five minute TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(5), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
