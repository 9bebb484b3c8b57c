package com.nexus.resolution.cache;

import com.nexus.resolution.core.model.EntityType;

import java.util.Optional;

/**
 * Remembers which canonical a normalized name last resolved to.
 *
 * <p>A hit is only a hint: the pipeline still merges through the leased, idempotent path and
 * re-resolves redirects, so a stale entry can cost a lookup but never a wrong write.</p>
 */
public interface ResolutionCache {

    /**
     * @return the canonical id last resolved for the name, or empty
     */
    Optional<String> get(EntityType entityType, String normalizedName);

    void put(EntityType entityType, String normalizedName, String canonicalId);

    /**
     * Drops every entry pointing at the canonical.
     */
    void invalidate(String canonicalId);

    void invalidateAll();

    CacheStats getStats();
}
