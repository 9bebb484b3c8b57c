package com.nexus.resolution.merge;

/**
 * Notified after a canonical has been merged into another, e.g. to invalidate caches
 * that still map names to the merged-away id.
 */
public interface MergeListener {

    void onMerge(String sourceCanonicalId, String targetCanonicalId);
}
