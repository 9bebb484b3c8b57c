package com.nexus.resolution.lock;

import java.time.Duration;

/**
 * Settings for graph-backed leases.
 *
 * @param ttl        how long an unreleased lease survives before another owner may reclaim it
 * @param retryDelay pause between acquisition attempts while waiting
 */
public record LeaseConfig(Duration ttl, Duration retryDelay) {

    public LeaseConfig {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (retryDelay == null || retryDelay.isNegative() || retryDelay.isZero()) {
            throw new IllegalArgumentException("retryDelay must be positive");
        }
    }

    /**
     * 30s TTL, 50ms retry delay.
     */
    public static LeaseConfig defaults() {
        return new LeaseConfig(Duration.ofSeconds(30), Duration.ofMillis(50));
    }
}
