package com.nexus.resolution.merge;

import com.nexus.resolution.graph.GraphWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for graph writes. Only {@link GraphWriteException} is retried;
 * the last one is rethrown once attempts are exhausted.
 *
 * @param maxAttempts    total attempts, including the first
 * @param initialBackoff pause after the first failure, doubled after each further one
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff) {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public <T> T execute(String operation, Supplier<T> action) {
        long backoffMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (GraphWriteException e) {
                if (attempt >= maxAttempts) {
                    log.error("graph.write_exhausted operation={} attempts={} cause={}",
                            operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("graph.write_retry operation={} attempt={} backoffMs={} cause={}",
                        operation, attempt, backoffMs, e.getMessage());
                sleep(backoffMs, e);
                backoffMs *= 2;
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private static void sleep(long millis, GraphWriteException pending) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(e);
            throw pending;
        }
    }
}
