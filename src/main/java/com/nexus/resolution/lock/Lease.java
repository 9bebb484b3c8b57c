package com.nexus.resolution.lock;

import java.time.Instant;

/**
 * Exclusive hold on one key, released on {@link #close()}. Closing twice is harmless.
 */
public interface Lease extends AutoCloseable {

    String key();

    Instant acquiredAt();

    @Override
    void close();
}
