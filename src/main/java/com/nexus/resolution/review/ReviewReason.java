package com.nexus.resolution.review;

/**
 * Why an item was routed to the review queue.
 */
public enum ReviewReason {
    AMBIGUOUS_SCORE("ambiguous_score"),
    TIED_LEADERS("tied_leaders"),
    ADJUDICATION_FAILED("adjudication_failed"),
    ADJUDICATION_CONFLICT("adjudication_conflict"),
    ADJUDICATION_INCONCLUSIVE("adjudication_inconclusive"),
    ADJUDICATOR_UNAVAILABLE("adjudicator_unavailable"),
    MERGE_LOCK_TIMEOUT("merge_lock_timeout"),
    RELATIONSHIP_UNDECIDED("relationship_undecided");

    private final String code;

    ReviewReason(String code) {
        this.code = code;
    }

    /**
     * Stable machine-readable reason, used in logs and metric tags.
     */
    public String code() {
        return code;
    }

    public static ReviewReason fromCode(String code) {
        for (ReviewReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown review reason: " + code);
    }
}
