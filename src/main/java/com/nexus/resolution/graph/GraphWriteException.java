package com.nexus.resolution.graph;

/**
 * A store mutation failed. Retried with backoff by the merge executor; exhausting the retries
 * dead-letters the candidate.
 */
public class GraphWriteException extends RuntimeException {

    public GraphWriteException(String message) {
        super(message);
    }

    public GraphWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
