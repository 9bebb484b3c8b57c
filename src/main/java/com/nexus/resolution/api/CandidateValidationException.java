package com.nexus.resolution.api;

import java.util.List;

/**
 * A candidate was rejected before scoring. Carries every violation found.
 */
public class CandidateValidationException extends RuntimeException {

    private final List<String> violations;

    public CandidateValidationException(List<String> violations) {
        super("Invalid candidate: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
