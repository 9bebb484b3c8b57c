package com.nexus.resolution.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for canonical-to-canonical merges.
 * Each step registers an undo action; a failing step, or closing without
 * {@link #markSuccess()}, runs the registered undo actions in reverse order.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     tx.execute("save target", () -> store.save(target), () -> store.save(targetBefore));
 *     tx.execute("redirect source", () -> store.markMerged(s, t), () -> store.save(sourceBefore));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensations = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Runs the step and registers its compensation. On failure earlier steps are compensated
     * and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("Executing merge step: {}", description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("merge.step_failed step='{}' cause={}; compensating {} steps",
                    description, e.getMessage(), compensations.size());
            compensate();
            throw e;
        }
        compensations.push(new CompensatingAction(description, compensation));
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("MergeTransaction closed without success, compensating");
            compensate();
        }
        closed = true;
    }

    private void compensate() {
        while (!compensations.isEmpty()) {
            CompensatingAction action = compensations.pop();
            try {
                log.debug("Compensating: {}", action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                // keep unwinding the remaining steps
                log.error("merge.compensation_failed step='{}' cause={}", action.description(), e.getMessage(), e);
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
