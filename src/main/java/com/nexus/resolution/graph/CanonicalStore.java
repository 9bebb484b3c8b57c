package com.nexus.resolution.graph;

import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage of canonical entities, their redirects and their relationship edges.
 *
 * <p>Reads return detached snapshots and never block on merges in progress. Writes throw
 * {@link GraphWriteException} on store failure. Mutual exclusion is not the store's concern;
 * callers hold a lease from a {@code LeaseManager} around read-modify-write cycles.</p>
 */
public interface CanonicalStore {

    /**
     * Active canonicals of the given type indexed under the blocking key, by name or alias.
     */
    List<CanonicalEntity> findByBlockingKey(EntityType type, String key);

    /**
     * Union of {@link #findByBlockingKey} over several keys, deduplicated and capped.
     */
    default List<CanonicalEntity> findBlockingSet(EntityType type, Collection<String> keys, int limit) {
        Map<String, CanonicalEntity> byId = new LinkedHashMap<>();
        for (String key : keys) {
            for (CanonicalEntity entity : findByBlockingKey(type, key)) {
                if (byId.size() >= limit) {
                    return List.copyOf(byId.values());
                }
                byId.putIfAbsent(entity.getId(), entity);
            }
        }
        return List.copyOf(byId.values());
    }

    /**
     * Any canonical by id, including merged-away redirects.
     */
    Optional<CanonicalEntity> findById(String id);

    /**
     * Id of the canonical that absorbed the ingestion id. May be a merged-away id.
     */
    Optional<String> findByIngestionId(String ingestionId);

    /**
     * Active canonicals with exactly this normalized primary name, oldest first.
     */
    List<CanonicalEntity> findByNormalizedName(EntityType type, String normalizedName);

    List<CanonicalEntity> findActive(EntityType type);

    /**
     * Persists a new canonical and indexes its names, aliases and ingestion ids.
     *
     * @return the canonical id
     */
    String createCanonical(CanonicalEntity entity);

    /**
     * Replaces the stored state of an existing canonical and reindexes it.
     */
    void save(CanonicalEntity entity);

    /**
     * Turns the source into a redirect to the target and removes it from blocking.
     */
    void markMerged(String sourceId, String targetId);

    /**
     * Creates the edge, or raises the confidence of an existing edge with the same subject,
     * predicate and object to the max of both.
     */
    Relationship createRelationship(String subjectId, String predicate, String objectId,
                                    double confidence, String provenance);

    /**
     * Writes the edge exactly as given, replacing any edge with the same id.
     */
    void saveRelationship(Relationship relationship);

    void deleteRelationship(String relationshipId);

    /**
     * Edges where the canonical is subject or object.
     */
    List<Relationship> findRelationships(String canonicalId);

    /**
     * Moves every edge touching {@code fromId} onto {@code toId}. Edges that would become
     * self-loops are removed; edges duplicating an existing one are folded into it.
     *
     * @return the edges as they were before repointing
     */
    List<Relationship> repointRelationships(String fromId, String toId);
}
