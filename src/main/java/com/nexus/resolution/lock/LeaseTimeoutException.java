package com.nexus.resolution.lock;

import java.time.Duration;

/**
 * A merge lease could not be obtained within its timeout.
 * The pipeline routes the candidate to review with reason {@code merge_lock_timeout}.
 */
public class LeaseTimeoutException extends RuntimeException {

    private final String key;
    private final Duration timeout;

    public LeaseTimeoutException(String key, Duration timeout) {
        super("Failed to acquire lease for key '" + key + "' within " + timeout.toMillis() + "ms");
        this.key = key;
        this.timeout = timeout;
    }

    public LeaseTimeoutException(String key, Duration timeout, Throwable cause) {
        super("Interrupted while acquiring lease for key '" + key + "'", cause);
        this.key = key;
        this.timeout = timeout;
    }

    public String getKey() {
        return key;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
