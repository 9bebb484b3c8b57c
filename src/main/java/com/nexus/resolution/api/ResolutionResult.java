package com.nexus.resolution.api;

import com.nexus.resolution.adjudication.AdjudicationOutcome;
import com.nexus.resolution.core.model.ResolutionDecision;
import com.nexus.resolution.review.ReviewReason;

import java.util.Objects;

/**
 * What happened to one candidate.
 *
 * @param canonicalId  the surviving canonical for MERGED, CREATED and ALREADY_RESOLVED, else null
 * @param reviewItemId the pending review item for QUEUED_FOR_REVIEW, else null
 * @param decision     the decision engine's output, null if resolution stopped before scoring
 * @param adjudication the adjudicator's outcome, null if it was not consulted
 * @param failureCause why the candidate was dead-lettered, else null
 */
public record ResolutionResult(
        Outcome outcome,
        String ingestionId,
        String canonicalId,
        String reviewItemId,
        ReviewReason reviewReason,
        ResolutionDecision decision,
        AdjudicationOutcome adjudication,
        double topScore,
        String failureCause
) {

    public enum Outcome {
        MERGED,
        CREATED,
        QUEUED_FOR_REVIEW,
        ALREADY_RESOLVED,
        DEAD_LETTERED
    }

    public ResolutionResult {
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(ingestionId, "ingestionId is required");
    }

    public static ResolutionResult merged(String ingestionId, String canonicalId, ResolutionDecision decision,
                                          AdjudicationOutcome adjudication, double topScore) {
        return new ResolutionResult(Outcome.MERGED, ingestionId, canonicalId, null, null,
                decision, adjudication, topScore, null);
    }

    public static ResolutionResult created(String ingestionId, String canonicalId, ResolutionDecision decision,
                                           AdjudicationOutcome adjudication, double topScore) {
        return new ResolutionResult(Outcome.CREATED, ingestionId, canonicalId, null, null,
                decision, adjudication, topScore, null);
    }

    public static ResolutionResult alreadyResolved(String ingestionId, String canonicalId) {
        return new ResolutionResult(Outcome.ALREADY_RESOLVED, ingestionId, canonicalId, null, null,
                null, null, 0.0, null);
    }

    public static ResolutionResult queued(String ingestionId, String reviewItemId, ReviewReason reason,
                                          ResolutionDecision decision, AdjudicationOutcome adjudication,
                                          double topScore) {
        return new ResolutionResult(Outcome.QUEUED_FOR_REVIEW, ingestionId, null, reviewItemId, reason,
                decision, adjudication, topScore, null);
    }

    public static ResolutionResult deadLettered(String ingestionId, ResolutionDecision decision, String cause) {
        return new ResolutionResult(Outcome.DEAD_LETTERED, ingestionId, null, null, null,
                decision, null, 0.0, cause);
    }

    /**
     * True if the candidate now belongs to a canonical.
     */
    public boolean isResolved() {
        return outcome == Outcome.MERGED || outcome == Outcome.CREATED || outcome == Outcome.ALREADY_RESOLVED;
    }

    public boolean isQueued() {
        return outcome == Outcome.QUEUED_FOR_REVIEW;
    }
}
