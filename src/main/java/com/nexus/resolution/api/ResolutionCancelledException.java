package com.nexus.resolution.api;

/**
 * A resolution was cancelled before its merge critical section started.
 */
public class ResolutionCancelledException extends RuntimeException {

    public ResolutionCancelledException(String message) {
        super(message);
    }
}
