package com.nexus.resolution.review;

import com.nexus.resolution.adjudication.AdjudicationOutcome;
import com.nexus.resolution.api.CancellationToken;
import com.nexus.resolution.api.Page;
import com.nexus.resolution.api.PageRequest;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.core.model.SimilarityScore;
import com.nexus.resolution.logging.LogContext;
import com.nexus.resolution.merge.MergeExecutor;
import com.nexus.resolution.merge.MergeResult;
import com.nexus.resolution.metrics.MetricsService;
import com.nexus.resolution.metrics.NoOpMetricsService;
import com.nexus.resolution.rules.NormalizationEngine;
import com.nexus.resolution.similarity.BlockingKeyStrategy;
import com.nexus.resolution.similarity.DefaultBlockingKeyStrategy;
import com.nexus.resolution.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates the review queue with the merge executor.
 *
 * <p>Enqueueing attaches a candidate to an existing pending item when one of the same type and
 * blocking key scores at least the re-attach threshold against it. The search is bounded by the
 * re-attach timeout; when it runs out a new item is created and flagged.</p>
 *
 * <p>Resolution is applied through the {@link MergeExecutor} first and recorded afterwards, so
 * an item whose merge failed stays pending and can be resolved again. An item being resolved
 * takes no new attachments; candidates arriving meanwhile get an item of their own.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final MergeExecutor mergeExecutor;
    private final SimilarityScorer similarityScorer;
    private final NormalizationEngine normalizationEngine;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final double reattachThreshold;
    private final Duration reattachTimeout;
    private final MetricsService metricsService;
    private final ReentrantLock enqueueLock = new ReentrantLock();
    private final Set<String> resolving = ConcurrentHashMap.newKeySet();

    private ReviewService(Builder builder) {
        this.reviewQueue = Objects.requireNonNull(builder.reviewQueue, "reviewQueue is required");
        this.mergeExecutor = Objects.requireNonNull(builder.mergeExecutor, "mergeExecutor is required");
        this.similarityScorer = Objects.requireNonNull(builder.similarityScorer, "similarityScorer is required");
        this.normalizationEngine = Objects.requireNonNull(builder.normalizationEngine, "normalizationEngine is required");
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();
        this.reattachThreshold = builder.reattachThreshold;
        this.reattachTimeout = builder.reattachTimeout;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Files an undecided candidate. Returns the pending item the candidate now belongs to,
     * which is an existing item if it was attached or already queued.
     */
    public ReviewItem enqueue(CandidateEntity candidate, List<SimilarityScore> topScores,
                              AdjudicationOutcome adjudicationOutcome, ReviewReason reason) {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(reason, "reason is required");
        String blockingKey = primaryBlockingKey(candidate);
        long deadline = System.nanoTime() + reattachTimeout.toNanos();
        boolean timedOut = false;

        boolean locked;
        try {
            locked = enqueueLock.tryLock(reattachTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            locked = false;
        }
        try {
            if (locked) {
                ReviewItem existing = reviewQueue.findPendingByIngestionId(candidate.ingestionId());
                if (existing != null) {
                    log.debug("Candidate {} already queued in review item {}", candidate.ingestionId(), existing.getId());
                    return existing;
                }

                ReviewItem best = null;
                double bestScore = -1.0;
                for (ReviewItem item : reviewQueue.findPendingByBlockingKey(candidate.type(), blockingKey)) {
                    if (System.nanoTime() > deadline) {
                        timedOut = true;
                        break;
                    }
                    if (resolving.contains(item.getId())) {
                        continue;
                    }
                    double score = similarityScorer.scoreCandidates(item.getCandidate(), candidate);
                    if (score >= reattachThreshold && score > bestScore) {
                        best = item;
                        bestScore = score;
                    }
                }
                if (best != null && !timedOut) {
                    reviewQueue.attach(best.getId(), candidate);
                    log.info("review.attached reviewItemId={} ingestionId={} score={}",
                            best.getId(), candidate.ingestionId(), bestScore);
                    return best;
                }
            } else {
                timedOut = true;
            }

            if (timedOut) {
                log.warn("review.reattach_timeout ingestionId={} timeoutMs={}",
                        candidate.ingestionId(), reattachTimeout.toMillis());
            }
            ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                    .candidate(candidate)
                    .reason(reason)
                    .topScores(topScores)
                    .blockingKey(blockingKey)
                    .adjudicationOutcome(adjudicationOutcome)
                    .reattachTimedOut(timedOut)
                    .build());
            metricsService.incrementReviewQueued(reason.code());
            log.info("review.queued reviewItemId={} ingestionId={} reason={} top={}",
                    item.getId(), candidate.ingestionId(), reason.code(), item.getTopAggregate());
            return item;
        } finally {
            if (locked) {
                enqueueLock.unlock();
            }
        }
    }

    /**
     * Files a proposed edge whose confidence fell between the thresholds.
     */
    public ReviewItem enqueueRelationship(Relationship proposed) {
        Objects.requireNonNull(proposed, "proposed relationship is required");
        ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                .proposedRelationship(proposed)
                .reason(ReviewReason.RELATIONSHIP_UNDECIDED)
                .build());
        metricsService.incrementReviewQueued(ReviewReason.RELATIONSHIP_UNDECIDED.code());
        log.info("review.queued reviewItemId={} subjectId={} predicate={} objectId={} confidence={}",
                item.getId(), proposed.getSubjectId(), proposed.getPredicate(), proposed.getObjectId(),
                proposed.getConfidence());
        return item;
    }

    public Page<ReviewItem> listPending(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> listPendingByReason(ReviewReason reason, PageRequest page) {
        return reviewQueue.getPendingByReason(reason, page);
    }

    public long countPending() {
        return reviewQueue.countPending();
    }

    public ReviewItem get(String itemId) {
        return reviewQueue.get(itemId);
    }

    /**
     * Applies a reviewer's decision and archives the item.
     *
     * <p>Entity items: {@code MERGE} merges the candidate and every attached candidate into
     * {@code targetId}; {@code DISTINCT} creates a canonical from the main candidate, even if
     * one with the same name exists, and merges the attached ones into it. Relationship items: {@code MERGE} creates the edge,
     * {@code DISTINCT} discards it and {@code targetId} is ignored.</p>
     *
     * @return the archived item, with the surviving canonical or created edge id as target
     * @throws IllegalArgumentException if the item is unknown or a merge has no target
     * @throws IllegalStateException if the item is not pending or is being resolved concurrently
     */
    public ReviewItem resolve(String itemId, ReviewResolution outcome, String targetId,
                              String actorId, String rationale) {
        Objects.requireNonNull(outcome, "outcome is required");
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId is required");
        }
        ReviewItem item = reviewQueue.get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + itemId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + itemId);
        }
        if (outcome == ReviewResolution.MERGE && item.getKind() == ReviewKind.ENTITY
                && (targetId == null || targetId.isBlank())) {
            throw new IllegalArgumentException("A merge resolution requires a target canonical id");
        }
        item = claim(itemId);

        try (LogContext ctx = LogContext.forReview(itemId, actorId)) {
            String resolvedTarget = item.getKind() == ReviewKind.ENTITY
                    ? applyEntityResolution(item, outcome, targetId)
                    : applyRelationshipResolution(item, outcome);
            ReviewStatus status = outcome == ReviewResolution.MERGE
                    ? ReviewStatus.RESOLVED_MERGE : ReviewStatus.RESOLVED_DISTINCT;
            reviewQueue.markResolved(itemId, status, resolvedTarget, actorId, rationale);
            log.info("review.resolved reviewItemId={} outcome={} targetId={} actorId={} rationale='{}'",
                    itemId, outcome, resolvedTarget, actorId, rationale);
            return reviewQueue.get(itemId);
        } finally {
            resolving.remove(itemId);
        }
    }

    /**
     * Marks the item as being resolved and returns its candidates as of that moment. Runs under
     * the enqueue lock, so every attachment is either in the returned item or goes elsewhere.
     */
    private ReviewItem claim(String itemId) {
        enqueueLock.lock();
        try {
            if (!resolving.add(itemId)) {
                throw new IllegalStateException("Review item is already being resolved: " + itemId);
            }
            ReviewItem current = reviewQueue.get(itemId);
            if (current == null || !current.isPending()) {
                resolving.remove(itemId);
                throw new IllegalStateException("Review item is not pending: " + itemId);
            }
            return current;
        } finally {
            enqueueLock.unlock();
        }
    }

    private String applyEntityResolution(ReviewItem item, ReviewResolution outcome, String targetId) {
        List<CandidateEntity> candidates = item.getAllCandidates();
        String survivorId;
        int start;
        if (outcome == ReviewResolution.MERGE) {
            survivorId = targetId;
            start = 0;
        } else {
            MergeResult created = mergeExecutor.applyConfirmedDistinct(candidates.get(0), CancellationToken.create());
            survivorId = created.canonicalId();
            start = 1;
        }
        for (CandidateEntity candidate : candidates.subList(start, candidates.size())) {
            MergeResult merged = mergeExecutor.applyMerge(candidate, survivorId, CancellationToken.create());
            survivorId = merged.canonicalId();
        }
        return survivorId;
    }

    private String applyRelationshipResolution(ReviewItem item, ReviewResolution outcome) {
        Relationship proposed = item.getProposedRelationship();
        if (outcome == ReviewResolution.DISTINCT) {
            return null;
        }
        String subjectId = mergeExecutor.resolveSurvivor(proposed.getSubjectId());
        String objectId = mergeExecutor.resolveSurvivor(proposed.getObjectId());
        if (subjectId.equals(objectId)) {
            log.info("review.relationship_collapsed reviewItemId={} canonicalId={}", item.getId(), subjectId);
            return null;
        }
        Relationship created = mergeExecutor.createRelationship(
                subjectId, proposed.getPredicate(), objectId, proposed.getConfidence(), proposed.getProvenance());
        return created.getId();
    }

    private String primaryBlockingKey(CandidateEntity candidate) {
        String normalized = normalizationEngine.normalize(candidate.name(), candidate.type());
        return blockingKeyStrategy.generateKeys(normalized).stream().findFirst().orElse(normalized);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReviewQueue reviewQueue;
        private MergeExecutor mergeExecutor;
        private SimilarityScorer similarityScorer;
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private double reattachThreshold = 0.85;
        private Duration reattachTimeout = Duration.ofSeconds(2);
        private MetricsService metricsService;

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder mergeExecutor(MergeExecutor mergeExecutor) {
            this.mergeExecutor = mergeExecutor;
            return this;
        }

        public Builder similarityScorer(SimilarityScorer similarityScorer) {
            this.similarityScorer = similarityScorer;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder reattachThreshold(double reattachThreshold) {
            this.reattachThreshold = reattachThreshold;
            return this;
        }

        public Builder reattachTimeout(Duration reattachTimeout) {
            this.reattachTimeout = reattachTimeout;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public ReviewService build() {
            if (reattachThreshold < 0.0 || reattachThreshold > 1.0) {
                throw new IllegalArgumentException("reattachThreshold must be in [0,1]");
            }
            if (reattachTimeout == null || reattachTimeout.isNegative() || reattachTimeout.isZero()) {
                throw new IllegalArgumentException("reattachTimeout must be positive");
            }
            return new ReviewService(this);
        }
    }
}
