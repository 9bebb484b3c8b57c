package com.nexus.resolution.adjudication;

import com.nexus.resolution.review.ReviewReason;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Gateway result. Only {@link Kind#MERGE} and {@link Kind#DISTINCT} may act on the graph;
 * everything else carries the reason the candidate goes to review.
 */
public record AdjudicationOutcome(
        Kind kind,
        String canonicalId,
        ReviewReason reviewReason,
        List<Verdict> verdicts,
        int attempts
) {
    public enum Kind {
        MERGE,
        DISTINCT,
        REVIEW
    }

    public AdjudicationOutcome {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == Kind.MERGE && canonicalId == null) {
            throw new IllegalArgumentException("MERGE requires a canonicalId");
        }
        if (kind == Kind.REVIEW && reviewReason == null) {
            throw new IllegalArgumentException("REVIEW requires a reason");
        }
        verdicts = verdicts != null ? List.copyOf(verdicts) : List.of();
    }

    public static AdjudicationOutcome merge(String canonicalId, List<Verdict> verdicts, int attempts) {
        return new AdjudicationOutcome(Kind.MERGE, canonicalId, null, verdicts, attempts);
    }

    public static AdjudicationOutcome distinct(List<Verdict> verdicts, int attempts) {
        return new AdjudicationOutcome(Kind.DISTINCT, null, null, verdicts, attempts);
    }

    public static AdjudicationOutcome review(ReviewReason reason, List<Verdict> verdicts, int attempts) {
        return new AdjudicationOutcome(Kind.REVIEW, null, reason, verdicts, attempts);
    }

    public boolean isMerge() {
        return kind == Kind.MERGE;
    }

    public boolean isDistinct() {
        return kind == Kind.DISTINCT;
    }

    public boolean isReview() {
        return kind == Kind.REVIEW;
    }

    /**
     * Metric/log label: the kind, or the review reason code.
     */
    public String label() {
        return kind == Kind.REVIEW ? reviewReason.code() : kind.name().toLowerCase(Locale.ROOT);
    }
}
