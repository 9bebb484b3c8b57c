package com.nexus.resolution.api;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted candidate's pending result. {@link #cancel()} only succeeds before the merge
 * executor starts mutating the graph.
 */
public final class ResolutionHandle {

    private final String ingestionId;
    private final CancellationToken token;
    private final CompletableFuture<ResolutionResult> future;

    ResolutionHandle(String ingestionId, CancellationToken token, CompletableFuture<ResolutionResult> future) {
        this.ingestionId = ingestionId;
        this.token = token;
        this.future = future;
    }

    public String getIngestionId() {
        return ingestionId;
    }

    public CompletableFuture<ResolutionResult> future() {
        return future;
    }

    /**
     * Waits for the result.
     *
     * @throws java.util.concurrent.CompletionException if resolution failed
     * @throws java.util.concurrent.CancellationException if it was cancelled
     */
    public ResolutionResult join() {
        return future.join();
    }

    /**
     * @return true if the candidate will not mutate the graph; false if mutation had
     *         already started or the result is complete
     */
    public boolean cancel() {
        if (future.isDone()) {
            return future.isCancelled();
        }
        if (!token.cancel()) {
            return false;
        }
        future.cancel(false);
        return true;
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }
}
