package com.nexus.resolution.review;

import com.nexus.resolution.api.Page;
import com.nexus.resolution.api.PageRequest;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private static final Comparator<ReviewItem> OLDEST_FIRST =
            Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId);

    private final ConcurrentMap<String, ReviewItem> pending = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReviewItem> archive = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        if (!item.isPending()) {
            throw new IllegalArgumentException("Only pending items can be submitted: " + item.getId());
        }
        if (pending.putIfAbsent(item.getId(), item) != null || archive.containsKey(item.getId())) {
            throw new IllegalStateException("Review item already exists: " + item.getId());
        }
        log.debug("Submitted review item {} (kind={}, reason={})", item.getId(), item.getKind(), item.getReason().code());
        return item;
    }

    @Override
    public void attach(String itemId, CandidateEntity candidate) {
        ReviewItem item = pending.get(itemId);
        if (item == null) {
            if (archive.containsKey(itemId)) {
                throw new IllegalStateException("Review item is not pending: " + itemId);
            }
            throw new IllegalArgumentException("Review item not found: " + itemId);
        }
        item.attach(candidate);
    }

    @Override
    public List<ReviewItem> findPendingByBlockingKey(EntityType type, String blockingKey) {
        return pending.values().stream()
                .filter(item -> item.getKind() == ReviewKind.ENTITY)
                .filter(item -> item.getEntityType() == type)
                .filter(item -> Objects.equals(blockingKey, item.getBlockingKey()))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public ReviewItem findPendingByIngestionId(String ingestionId) {
        return pending.values().stream()
                .filter(item -> item.getKind() == ReviewKind.ENTITY)
                .filter(item -> item.containsIngestion(ingestionId))
                .min(OLDEST_FIRST)
                .orElse(null);
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        List<ReviewItem> ordered = pending.values().stream().sorted(OLDEST_FIRST).toList();
        return Page.of(ordered, page);
    }

    @Override
    public Page<ReviewItem> getPendingByReason(ReviewReason reason, PageRequest page) {
        List<ReviewItem> ordered = pending.values().stream()
                .filter(item -> item.getReason() == reason)
                .sorted(OLDEST_FIRST)
                .toList();
        return Page.of(ordered, page);
    }

    @Override
    public synchronized void markResolved(String itemId, ReviewStatus status, String targetId,
                                          String actorId, String rationale) {
        ReviewItem item = pending.get(itemId);
        if (item == null) {
            if (archive.containsKey(itemId)) {
                throw new IllegalStateException("Review item is not pending: " + itemId);
            }
            throw new IllegalArgumentException("Review item not found: " + itemId);
        }
        item.markResolved(status, targetId, actorId, rationale);
        archive.put(itemId, item);
        pending.remove(itemId);
        log.debug("Archived review item {} as {}", itemId, status);
    }

    @Override
    public ReviewItem get(String itemId) {
        ReviewItem item = pending.get(itemId);
        return item != null ? item : archive.get(itemId);
    }

    @Override
    public long countPending() {
        return pending.size();
    }
}
