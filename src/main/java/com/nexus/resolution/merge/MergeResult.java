package com.nexus.resolution.merge;

import java.util.Objects;

/**
 * What the merge executor did with a decision.
 *
 * @param outcome          kind of mutation applied
 * @param canonicalId      the surviving canonical the candidate now belongs to
 * @param absorbedId       for canonical-to-canonical merges, the id that became a redirect
 * @param aliasAdded       whether the candidate's name became a new alias
 * @param conflictsFlagged attribute conflicts recorded by this merge
 */
public record MergeResult(
        Outcome outcome,
        String canonicalId,
        String absorbedId,
        boolean aliasAdded,
        int conflictsFlagged
) {
    public enum Outcome {
        CREATED,
        MERGED,
        ALREADY_APPLIED,
        CANONICALS_MERGED
    }

    public MergeResult {
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
    }

    public static MergeResult created(String canonicalId) {
        return new MergeResult(Outcome.CREATED, canonicalId, null, true, 0);
    }

    public static MergeResult merged(String canonicalId, boolean aliasAdded, int conflictsFlagged) {
        return new MergeResult(Outcome.MERGED, canonicalId, null, aliasAdded, conflictsFlagged);
    }

    public static MergeResult alreadyApplied(String canonicalId) {
        return new MergeResult(Outcome.ALREADY_APPLIED, canonicalId, null, false, 0);
    }

    public static MergeResult canonicalsMerged(String survivorId, String absorbedId, int conflictsFlagged) {
        return new MergeResult(Outcome.CANONICALS_MERGED, survivorId, absorbedId, false, conflictsFlagged);
    }

    public boolean mutated() {
        return outcome != Outcome.ALREADY_APPLIED;
    }
}
