package com.nexus.resolution.relationship;

import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.decision.ConfidenceTier;
import com.nexus.resolution.decision.DecisionEngine;
import com.nexus.resolution.graph.GraphWriteException;
import com.nexus.resolution.merge.MergeChainException;
import com.nexus.resolution.merge.MergeExecutor;
import com.nexus.resolution.review.ReviewItem;
import com.nexus.resolution.review.ReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates relationship edges between resolved canonicals after resolution.
 *
 * <p>Every proposed edge goes through {@link DecisionEngine#classify(double)}: accepted edges
 * are stored, rejected ones dropped, and the rest queued for review. An accepted edge whose
 * write still fails after the merge executor's retries is reported in
 * {@link InferenceResult#failed()} and does not abort the pass.</p>
 */
public class RelationshipInferencer {
    private static final Logger log = LoggerFactory.getLogger(RelationshipInferencer.class);

    private final RelationshipExtractor extractor;
    private final MergeExecutor mergeExecutor;
    private final DecisionEngine decisionEngine;
    private final ReviewService reviewService;

    public RelationshipInferencer(RelationshipExtractor extractor, MergeExecutor mergeExecutor,
                                  DecisionEngine decisionEngine, ReviewService reviewService) {
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.mergeExecutor = Objects.requireNonNull(mergeExecutor, "mergeExecutor is required");
        this.decisionEngine = Objects.requireNonNull(decisionEngine, "decisionEngine is required");
        this.reviewService = Objects.requireNonNull(reviewService, "reviewService is required");
    }

    /**
     * @param resolvedIds   canonical ids produced by resolution, possibly since merged away
     * @param sourceContext the text the entities came from
     */
    public InferenceResult infer(Collection<String> resolvedIds, String sourceContext) {
        List<CanonicalEntity> entities = loadSurvivors(resolvedIds);
        if (entities.size() < 2) {
            return InferenceResult.empty();
        }
        Map<String, CanonicalEntity> byId = new LinkedHashMap<>();
        entities.forEach(e -> byId.put(e.getId(), e));

        List<RelationshipCandidate> proposed;
        try {
            proposed = extractor.extract(entities, sourceContext != null ? sourceContext : "");
        } catch (RuntimeException e) {
            log.warn("relationship.extraction_failed extractor={} entities={} cause={}",
                    extractor.getName(), byId.keySet(), e.getMessage());
            return InferenceResult.empty();
        }

        String provenance = "inference:" + extractor.getName();
        List<Relationship> created = new ArrayList<>();
        List<ReviewItem> queued = new ArrayList<>();
        List<RelationshipCandidate> failed = new ArrayList<>();
        int discarded = 0;

        for (RelationshipCandidate candidate : proposed) {
            if (!byId.containsKey(candidate.subjectId()) || !byId.containsKey(candidate.objectId())
                    || candidate.subjectId().equals(candidate.objectId())) {
                log.debug("Dropping edge with unknown or identical endpoints: {}", candidate);
                discarded++;
                continue;
            }
            ConfidenceTier tier = decisionEngine.classify(candidate.confidence());
            switch (tier) {
                case ACCEPT -> {
                    try {
                        Relationship edge = mergeExecutor.createRelationship(candidate.subjectId(),
                                candidate.predicate(), candidate.objectId(), candidate.confidence(), provenance);
                        created.add(edge);
                        log.info("relationship.created relationshipId={} subjectId={} predicate={} objectId={} confidence={}",
                                edge.getId(), edge.getSubjectId(), edge.getPredicate(), edge.getObjectId(),
                                candidate.confidence());
                    } catch (GraphWriteException e) {
                        log.error("relationship.write_failed subjectId={} predicate={} objectId={} cause='{}'",
                                candidate.subjectId(), candidate.predicate(), candidate.objectId(), e.getMessage());
                        failed.add(candidate);
                    }
                }
                case UNDECIDED -> queued.add(reviewService.enqueueRelationship(Relationship.builder()
                        .subjectId(candidate.subjectId())
                        .predicate(candidate.predicate())
                        .objectId(candidate.objectId())
                        .confidence(candidate.confidence())
                        .provenance(provenance)
                        .build()));
                case REJECT -> {
                    log.debug("Discarding low-confidence edge {}", candidate);
                    discarded++;
                }
            }
        }
        return new InferenceResult(created, queued, discarded, failed);
    }

    private List<CanonicalEntity> loadSurvivors(Collection<String> resolvedIds) {
        Map<String, CanonicalEntity> survivors = new LinkedHashMap<>();
        if (resolvedIds == null) {
            return List.of();
        }
        for (String id : resolvedIds) {
            try {
                String survivorId = mergeExecutor.resolveSurvivor(id);
                mergeExecutor.getStore().findById(survivorId).ifPresent(e -> survivors.putIfAbsent(survivorId, e));
            } catch (MergeChainException e) {
                log.warn("relationship.endpoint_unresolvable canonicalId={} cause={}", id, e.getMessage());
            }
        }
        return List.copyOf(survivors.values());
    }
}
