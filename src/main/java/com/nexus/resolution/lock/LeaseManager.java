package com.nexus.resolution.lock;

import java.time.Duration;

/**
 * Per-key mutual exclusion over canonical ids (and create-path keys).
 * Merges targeting the same key are serialized; different keys proceed independently.
 */
public interface LeaseManager {

    /**
     * Waits up to {@code timeout} for an exclusive lease on {@code key}.
     *
     * @throws LeaseTimeoutException if the lease is not obtained in time, or the wait is interrupted
     */
    Lease acquire(String key, Duration timeout);

    static String createKey(String entityType, String normalizedName) {
        return "create:" + entityType + ":" + normalizedName;
    }
}
