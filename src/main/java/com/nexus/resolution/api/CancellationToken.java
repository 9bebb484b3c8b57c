package com.nexus.resolution.api;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancellation flag for one resolution.
 *
 * <p>Cancellation only wins until the merge executor enters its critical section; from then on
 * the mutation runs to completion and {@link #cancel()} returns false.</p>
 */
public final class CancellationToken {

    private static final int ACTIVE = 0;
    private static final int CANCELLED = 1;
    private static final int COMMITTED = 2;

    private final AtomicInteger state = new AtomicInteger(ACTIVE);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if the resolution will not mutate the graph
     */
    public boolean cancel() {
        return state.compareAndSet(ACTIVE, CANCELLED) || state.get() == CANCELLED;
    }

    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }

    public boolean isCommitted() {
        return state.get() == COMMITTED;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new ResolutionCancelledException("Resolution cancelled");
        }
    }

    /**
     * Marks the start of graph mutation. Calling it again once committed is a no-op.
     *
     * @throws ResolutionCancelledException if cancellation won the race
     */
    public void enterCriticalSection() {
        if (!state.compareAndSet(ACTIVE, COMMITTED) && state.get() == CANCELLED) {
            throw new ResolutionCancelledException("Resolution cancelled before merge started");
        }
    }
}
