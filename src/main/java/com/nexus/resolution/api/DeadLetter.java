package com.nexus.resolution.api;

import com.nexus.resolution.core.model.CandidateEntity;

import java.time.Instant;

/**
 * A candidate whose graph writes kept failing.
 */
public record DeadLetter(CandidateEntity candidate, String cause, Instant failedAt) {

    public static DeadLetter of(CandidateEntity candidate, Throwable cause) {
        return new DeadLetter(candidate, cause.getClass().getSimpleName() + ": " + cause.getMessage(), Instant.now());
    }
}
