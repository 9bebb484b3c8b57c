package com.nexus.resolution.similarity;

/**
 * The embedding service could not produce a vector. Scoring treats this as a missing signal.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
