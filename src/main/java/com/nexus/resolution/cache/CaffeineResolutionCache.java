package com.nexus.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.merge.MergeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed resolution cache with a canonical-id index for targeted invalidation.
 * Registered as a {@link MergeListener} so entries for merged-away canonicals are dropped.
 */
public class CaffeineResolutionCache implements ResolutionCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, String> cache;
    private final ConcurrentMap<String, Set<CacheKey>> keysByCanonical = new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .evictionListener((CacheKey key, String canonicalId, RemovalCause cause) -> {
                    if (key != null && canonicalId != null) {
                        unindex(canonicalId, key);
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttl().toSeconds());
    }

    @Override
    public Optional<String> get(EntityType entityType, String normalizedName) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(entityType, normalizedName)));
    }

    @Override
    public void put(EntityType entityType, String normalizedName, String canonicalId) {
        CacheKey key = new CacheKey(entityType, normalizedName);
        keysByCanonical.computeIfAbsent(canonicalId, k -> ConcurrentHashMap.newKeySet()).add(key);
        String previous = cache.asMap().put(key, canonicalId);
        if (previous != null && !previous.equals(canonicalId)) {
            unindex(previous, key);
        }
    }

    @Override
    public void invalidate(String canonicalId) {
        Set<CacheKey> keys = keysByCanonical.remove(canonicalId);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cache entries for canonical {}", keys.size(), canonicalId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        keysByCanonical.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    @Override
    public void onMerge(String sourceCanonicalId, String targetCanonicalId) {
        invalidate(sourceCanonicalId);
        log.debug("Cache invalidated for merge: {} -> {}", sourceCanonicalId, targetCanonicalId);
    }

    private void unindex(String canonicalId, CacheKey key) {
        keysByCanonical.computeIfPresent(canonicalId, (id, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }

    record CacheKey(EntityType entityType, String normalizedName) {}
}
