package com.nexus.resolution.cache;

/**
 * Cache counters.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
