package com.nexus.resolution.review;

import com.nexus.resolution.adjudication.AdjudicationOutcome;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.core.model.SimilarityScore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An undecided candidate entity or relationship edge waiting for an external reviewer.
 *
 * <p>Entity items carry the candidate, its top scored contenders and the adjudicator's outcome
 * if one was obtained. Near-identical candidates arriving later are attached to the same item
 * and follow its resolution.</p>
 */
public class ReviewItem {

    private final String id;
    private final ReviewKind kind;
    private final ReviewReason reason;
    private final CandidateEntity candidate;
    private final List<SimilarityScore> topScores;
    private final String blockingKey;
    private final AdjudicationOutcome adjudicationOutcome;
    private final Relationship proposedRelationship;
    private final boolean reattachTimedOut;
    private final Instant submittedAt;
    private final List<CandidateEntity> attachedCandidates = new ArrayList<>();
    private ReviewStatus status;
    private String resolvedTargetId;
    private String resolvedBy;
    private Instant resolvedAt;
    private String rationale;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = builder.proposedRelationship != null ? ReviewKind.RELATIONSHIP : ReviewKind.ENTITY;
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.candidate = builder.candidate;
        this.topScores = builder.topScores != null ? List.copyOf(builder.topScores) : List.of();
        this.blockingKey = builder.blockingKey;
        this.adjudicationOutcome = builder.adjudicationOutcome;
        this.proposedRelationship = builder.proposedRelationship;
        this.reattachTimedOut = builder.reattachTimedOut;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
        if (kind == ReviewKind.ENTITY && candidate == null) {
            throw new IllegalArgumentException("An entity review item requires a candidate");
        }
    }

    public String getId() {
        return id;
    }

    public ReviewKind getKind() {
        return kind;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public CandidateEntity getCandidate() {
        return candidate;
    }

    public EntityType getEntityType() {
        return candidate != null ? candidate.type() : null;
    }

    public List<SimilarityScore> getTopScores() {
        return topScores;
    }

    /**
     * Highest aggregate among the top scores, 0 if none were recorded.
     */
    public double getTopAggregate() {
        return topScores.isEmpty() ? 0.0 : topScores.get(0).aggregate();
    }

    public String getBlockingKey() {
        return blockingKey;
    }

    public AdjudicationOutcome getAdjudicationOutcome() {
        return adjudicationOutcome;
    }

    public Relationship getProposedRelationship() {
        return proposedRelationship;
    }

    /**
     * True if the duplicate-item search gave up before finishing, so this item may
     * overlap with another pending one.
     */
    public boolean isReattachTimedOut() {
        return reattachTimedOut;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized List<CandidateEntity> getAttachedCandidates() {
        return List.copyOf(attachedCandidates);
    }

    /**
     * The main candidate followed by every attached one.
     */
    public synchronized List<CandidateEntity> getAllCandidates() {
        List<CandidateEntity> all = new ArrayList<>(attachedCandidates.size() + 1);
        if (candidate != null) {
            all.add(candidate);
        }
        all.addAll(attachedCandidates);
        return all;
    }

    public synchronized boolean containsIngestion(String ingestionId) {
        return getAllCandidates().stream().anyMatch(c -> c.ingestionId().equals(ingestionId));
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    public synchronized String getResolvedTargetId() {
        return resolvedTargetId;
    }

    public synchronized String getResolvedBy() {
        return resolvedBy;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }

    public synchronized String getRationale() {
        return rationale;
    }

    synchronized void attach(CandidateEntity attached) {
        if (!isPending()) {
            throw new IllegalStateException("Cannot attach to a resolved review item: " + id);
        }
        attachedCandidates.add(attached);
    }

    synchronized void markResolved(ReviewStatus resolvedStatus, String targetId, String actorId, String note) {
        if (resolvedStatus == ReviewStatus.PENDING) {
            throw new IllegalArgumentException("Resolution status must not be PENDING");
        }
        if (!isPending()) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = resolvedStatus;
        this.resolvedTargetId = targetId;
        this.resolvedBy = actorId;
        this.rationale = note;
        this.resolvedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", reason=" + reason.code() +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewReason reason;
        private CandidateEntity candidate;
        private List<SimilarityScore> topScores;
        private String blockingKey;
        private AdjudicationOutcome adjudicationOutcome;
        private Relationship proposedRelationship;
        private boolean reattachTimedOut;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder reason(ReviewReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder candidate(CandidateEntity candidate) {
            this.candidate = candidate;
            return this;
        }

        public Builder topScores(List<SimilarityScore> topScores) {
            this.topScores = topScores;
            return this;
        }

        public Builder blockingKey(String blockingKey) {
            this.blockingKey = blockingKey;
            return this;
        }

        public Builder adjudicationOutcome(AdjudicationOutcome adjudicationOutcome) {
            this.adjudicationOutcome = adjudicationOutcome;
            return this;
        }

        /**
         * Makes this a relationship item.
         */
        public Builder proposedRelationship(Relationship proposedRelationship) {
            this.proposedRelationship = proposedRelationship;
            return this;
        }

        public Builder reattachTimedOut(boolean reattachTimedOut) {
            this.reattachTimedOut = reattachTimedOut;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
