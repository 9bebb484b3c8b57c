package com.nexus.resolution.cache;

import com.nexus.resolution.core.model.EntityType;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<String> get(EntityType entityType, String normalizedName) {
        return Optional.empty();
    }

    @Override
    public void put(EntityType entityType, String normalizedName, String canonicalId) {
        // no-op
    }

    @Override
    public void invalidate(String canonicalId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
