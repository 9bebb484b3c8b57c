package com.nexus.resolution.adjudication;

/**
 * The external adjudicator could not be called or answered with an error.
 */
public class AdjudicationException extends RuntimeException {

    public AdjudicationException(String message) {
        super(message);
    }

    public AdjudicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
