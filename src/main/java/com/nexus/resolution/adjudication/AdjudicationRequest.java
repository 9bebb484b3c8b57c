package com.nexus.resolution.adjudication;

import java.util.List;
import java.util.Objects;

/**
 * One structured question for the adjudicator: does the candidate refer to any of the contenders?
 */
public record AdjudicationRequest(
        CandidateProfile candidate,
        List<CandidateProfile> contenders,
        String sourceExcerpt
) {
    public AdjudicationRequest {
        Objects.requireNonNull(candidate, "candidate is required");
        if (contenders == null || contenders.isEmpty()) {
            throw new IllegalArgumentException("At least one contender is required");
        }
        contenders = List.copyOf(contenders);
        sourceExcerpt = sourceExcerpt != null ? sourceExcerpt : "";
    }
}
