package com.nexus.resolution.relationship;

import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.review.ReviewItem;

import java.util.List;

/**
 * What one inference pass did with the proposed edges. {@code failed} holds accepted edges
 * whose write kept failing after retries.
 */
public record InferenceResult(List<Relationship> created, List<ReviewItem> queued, int discarded,
                              List<RelationshipCandidate> failed) {

    public InferenceResult {
        created = created != null ? List.copyOf(created) : List.of();
        queued = queued != null ? List.copyOf(queued) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public static InferenceResult empty() {
        return new InferenceResult(List.of(), List.of(), 0, List.of());
    }
}
