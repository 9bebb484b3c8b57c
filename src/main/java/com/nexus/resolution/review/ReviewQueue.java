package com.nexus.resolution.review;

import com.nexus.resolution.api.Page;
import com.nexus.resolution.api.PageRequest;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.EntityType;

import java.util.List;

/**
 * Holding area for undecided items. Pending items are listed oldest first; resolved items are
 * archived and stay retrievable by id.
 */
public interface ReviewQueue {

    /**
     * Adds a new pending item.
     *
     * @return the submitted item
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Attaches a near-identical candidate to a pending item.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException if the item is no longer pending
     */
    void attach(String itemId, CandidateEntity candidate);

    /**
     * Pending entity items of the given type filed under the blocking key.
     */
    List<ReviewItem> findPendingByBlockingKey(EntityType type, String blockingKey);

    /**
     * Pending entity item whose main or attached candidates include the ingestion id, or null.
     */
    ReviewItem findPendingByIngestionId(String ingestionId);

    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByReason(ReviewReason reason, PageRequest page);

    /**
     * Moves a pending item to the archive with its resolution.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException if the item is not pending
     */
    void markResolved(String itemId, ReviewStatus status, String targetId, String actorId, String rationale);

    /**
     * Pending or archived item by id.
     *
     * @return the review item, or null if not found
     */
    ReviewItem get(String itemId);

    long countPending();
}
