package com.nexus.resolution.graph;

import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.similarity.BlockingKeyStrategy;
import com.nexus.resolution.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link CanonicalStore} for tests and single-process deployments.
 * Writes are serialized on the store; reads go straight to concurrent maps and return copies.
 */
public class InMemoryCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Map<String, CanonicalEntity> entities = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> blockingIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> indexedKeysById = new ConcurrentHashMap<>();
    private final Map<String, String> ingestionIndex = new ConcurrentHashMap<>();
    private final Map<String, Relationship> relationships = new ConcurrentHashMap<>();

    public InMemoryCanonicalStore() {
        this(new DefaultBlockingKeyStrategy());
    }

    public InMemoryCanonicalStore(BlockingKeyStrategy blockingKeyStrategy) {
        this.blockingKeyStrategy = blockingKeyStrategy;
    }

    @Override
    public List<CanonicalEntity> findByBlockingKey(EntityType type, String key) {
        Set<String> ids = blockingIndex.getOrDefault(indexKey(type, key), Set.of());
        List<CanonicalEntity> result = new ArrayList<>();
        for (String id : ids) {
            CanonicalEntity entity = entities.get(id);
            if (entity != null && entity.isActive()) {
                result.add(entity.copy());
            }
        }
        result.sort(Comparator.comparing(CanonicalEntity::getId));
        return result;
    }

    @Override
    public Optional<CanonicalEntity> findById(String id) {
        CanonicalEntity entity = entities.get(id);
        return entity != null ? Optional.of(entity.copy()) : Optional.empty();
    }

    @Override
    public Optional<String> findByIngestionId(String ingestionId) {
        return Optional.ofNullable(ingestionIndex.get(ingestionId));
    }

    @Override
    public List<CanonicalEntity> findByNormalizedName(EntityType type, String normalizedName) {
        return entities.values().stream()
                .filter(e -> e.isActive() && e.getType() == type && normalizedName.equals(e.getNormalizedName()))
                .sorted(Comparator.comparing(CanonicalEntity::getCreatedAt).thenComparing(CanonicalEntity::getId))
                .map(CanonicalEntity::copy)
                .toList();
    }

    @Override
    public List<CanonicalEntity> findActive(EntityType type) {
        return entities.values().stream()
                .filter(e -> e.isActive() && (type == null || e.getType() == type))
                .sorted(Comparator.comparing(CanonicalEntity::getId))
                .map(CanonicalEntity::copy)
                .toList();
    }

    @Override
    public synchronized String createCanonical(CanonicalEntity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new GraphWriteException("Canonical already exists: " + entity.getId());
        }
        CanonicalEntity stored = entity.copy();
        entities.put(stored.getId(), stored);
        reindex(stored);
        log.debug("Created canonical {} '{}'", stored.getId(), stored.getPrimaryName());
        return stored.getId();
    }

    @Override
    public synchronized void save(CanonicalEntity entity) {
        if (!entities.containsKey(entity.getId())) {
            throw new GraphWriteException("Unknown canonical: " + entity.getId());
        }
        CanonicalEntity stored = entity.copy();
        entities.put(stored.getId(), stored);
        reindex(stored);
    }

    @Override
    public synchronized void markMerged(String sourceId, String targetId) {
        CanonicalEntity source = entities.get(sourceId);
        if (source == null || !entities.containsKey(targetId)) {
            throw new GraphWriteException("Cannot redirect " + sourceId + " to " + targetId + ": unknown canonical");
        }
        CanonicalEntity updated = source.copy();
        updated.markMergedInto(targetId);
        entities.put(sourceId, updated);
        reindex(updated);
    }

    @Override
    public synchronized Relationship createRelationship(String subjectId, String predicate, String objectId,
                                                        double confidence, String provenance) {
        for (Relationship existing : relationships.values()) {
            if (existing.sameEdge(subjectId, predicate, objectId)) {
                if (confidence > existing.getConfidence()) {
                    Relationship raised = existing.withConfidence(confidence);
                    relationships.put(raised.getId(), raised);
                    return raised;
                }
                return existing;
            }
        }
        Relationship created = Relationship.builder()
                .subjectId(subjectId)
                .predicate(predicate)
                .objectId(objectId)
                .confidence(confidence)
                .provenance(provenance)
                .build();
        relationships.put(created.getId(), created);
        return created;
    }

    @Override
    public synchronized void saveRelationship(Relationship relationship) {
        relationships.put(relationship.getId(), relationship);
    }

    @Override
    public synchronized void deleteRelationship(String relationshipId) {
        relationships.remove(relationshipId);
    }

    @Override
    public List<Relationship> findRelationships(String canonicalId) {
        return relationships.values().stream()
                .filter(r -> r.getSubjectId().equals(canonicalId) || r.getObjectId().equals(canonicalId))
                .sorted(Comparator.comparing(Relationship::getCreatedAt).thenComparing(Relationship::getId))
                .toList();
    }

    @Override
    public synchronized List<Relationship> repointRelationships(String fromId, String toId) {
        List<Relationship> moved = findRelationships(fromId);
        for (Relationship original : moved) {
            relationships.remove(original.getId());
            Relationship repointed = original.repoint(fromId, toId);
            if (repointed.getSubjectId().equals(repointed.getObjectId())) {
                continue;
            }
            createRelationship(repointed.getSubjectId(), repointed.getPredicate(), repointed.getObjectId(),
                    repointed.getConfidence(), repointed.getProvenance());
        }
        return moved;
    }

    public int size() {
        return entities.size();
    }

    public void clear() {
        entities.clear();
        blockingIndex.clear();
        indexedKeysById.clear();
        ingestionIndex.clear();
        relationships.clear();
    }

    private void reindex(CanonicalEntity entity) {
        Set<String> previous = indexedKeysById.remove(entity.getId());
        if (previous != null) {
            for (String key : previous) {
                Set<String> ids = blockingIndex.get(key);
                if (ids != null) {
                    ids.remove(entity.getId());
                }
            }
        }
        for (String ingestionId : entity.getIngestionIds()) {
            if (entity.isActive()) {
                ingestionIndex.put(ingestionId, entity.getId());
            } else {
                ingestionIndex.putIfAbsent(ingestionId, entity.getId());
            }
        }
        if (!entity.isActive()) {
            return;
        }
        Set<String> keys = new HashSet<>();
        for (String key : blockingKeyStrategy.generateKeys(entity.getNormalizedName())) {
            keys.add(indexKey(entity.getType(), key));
        }
        for (Alias alias : entity.getAliases()) {
            for (String key : blockingKeyStrategy.generateKeys(alias.normalizedText())) {
                keys.add(indexKey(entity.getType(), key));
            }
        }
        for (String key : keys) {
            blockingIndex.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(entity.getId());
        }
        indexedKeysById.put(entity.getId(), keys);
    }

    private static String indexKey(EntityType type, String key) {
        return type.name() + "|" + key;
    }
}
