package com.nexus.resolution.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.AttributeConflict;
import com.nexus.resolution.core.model.AttributeProvenance;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityStatus;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.similarity.BlockingKeyStrategy;
import com.nexus.resolution.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link CanonicalStore} persisted in the graph.
 *
 * <p>Each canonical is a {@code :Canonical} node. Aliases, attributes, provenance and
 * conflicts are stored as JSON strings; blocking keys and ingestion ids as
 * {@code |}-delimited strings searched with {@code CONTAINS}. Merged-away nodes keep their
 * id and gain a {@code [:MERGED_INTO]} edge to the survivor. Relationships are
 * {@code [:RELATED]} edges carrying id, predicate, confidence and provenance.</p>
 */
public class GraphCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(GraphCanonicalStore.class);

    private static final String DELIMITER = "|";

    private static final String CANONICAL_COLUMNS = """
            c.id AS id, c.type AS type, c.primaryName AS primaryName, c.normalizedName AS normalizedName,
            c.aliases AS aliases, c.attributes AS attributes, c.provenance AS provenance,
            c.conflicts AS conflicts, c.ingestionIds AS ingestionIds, c.embedding AS embedding,
            c.status AS status, c.mergedInto AS mergedInto, c.createdAt AS createdAt,
            c.lastMergedAt AS lastMergedAt
            """;

    private static final String RELATIONSHIP_COLUMNS = """
            r.id AS id, a.id AS subjectId, r.predicate AS predicate, b.id AS objectId,
            r.confidence AS confidence, r.provenance AS provenance, r.createdAt AS createdAt
            """;

    private final GraphConnection connection;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ObjectMapper objectMapper;

    public GraphCanonicalStore(GraphConnection connection) {
        this(connection, new DefaultBlockingKeyStrategy());
    }

    public GraphCanonicalStore(GraphConnection connection, BlockingKeyStrategy blockingKeyStrategy) {
        this.connection = connection;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.objectMapper = new ObjectMapper();
        connection.createIndexes();
    }

    @Override
    public List<CanonicalEntity> findByBlockingKey(EntityType type, String key) {
        String query = """
                MATCH (c:Canonical)
                WHERE c.type = $type AND c.status = 'ACTIVE' AND c.blockingKeys CONTAINS $token
                RETURN %s
                ORDER BY c.id
                """.formatted(CANONICAL_COLUMNS);
        return mapCanonicals(connection.query(query, Map.of(
                "type", type.name(),
                "token", DELIMITER + key + DELIMITER
        )));
    }

    @Override
    public Optional<CanonicalEntity> findById(String id) {
        String query = """
                MATCH (c:Canonical {id: $id})
                RETURN %s
                """.formatted(CANONICAL_COLUMNS);
        List<CanonicalEntity> found = mapCanonicals(connection.query(query, Map.of("id", id)));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public Optional<String> findByIngestionId(String ingestionId) {
        String query = """
                MATCH (c:Canonical)
                WHERE c.ingestionIds CONTAINS $token
                RETURN c.id AS id, c.status AS status
                ORDER BY c.status ASC
                LIMIT 1
                """;
        List<Map<String, Object>> rows = connection.query(query,
                Map.of("token", DELIMITER + ingestionId + DELIMITER));
        return rows.isEmpty() ? Optional.empty() : Optional.of((String) rows.get(0).get("id"));
    }

    @Override
    public List<CanonicalEntity> findByNormalizedName(EntityType type, String normalizedName) {
        String query = """
                MATCH (c:Canonical)
                WHERE c.type = $type AND c.normalizedName = $normalizedName AND c.status = 'ACTIVE'
                RETURN %s
                ORDER BY c.createdAt ASC, c.id ASC
                """.formatted(CANONICAL_COLUMNS);
        return mapCanonicals(connection.query(query, Map.of(
                "type", type.name(),
                "normalizedName", normalizedName
        )));
    }

    @Override
    public List<CanonicalEntity> findActive(EntityType type) {
        if (type == null) {
            return mapCanonicals(connection.query("""
                    MATCH (c:Canonical)
                    WHERE c.status = 'ACTIVE'
                    RETURN %s
                    ORDER BY c.id
                    """.formatted(CANONICAL_COLUMNS)));
        }
        return mapCanonicals(connection.query("""
                MATCH (c:Canonical)
                WHERE c.type = $type AND c.status = 'ACTIVE'
                RETURN %s
                ORDER BY c.id
                """.formatted(CANONICAL_COLUMNS), Map.of("type", type.name())));
    }

    @Override
    public String createCanonical(CanonicalEntity entity) {
        String query = """
                CREATE (c:Canonical {
                    id: $id, type: $type, primaryName: $primaryName, normalizedName: $normalizedName,
                    aliases: $aliases, attributes: $attributes, provenance: $provenance,
                    conflicts: $conflicts, ingestionIds: $ingestionIds, embedding: $embedding,
                    blockingKeys: $blockingKeys, status: $status, mergedInto: $mergedInto,
                    createdAt: $createdAt, lastMergedAt: $lastMergedAt
                })
                """;
        write("createCanonical", query, toProperties(entity));
        log.debug("Created canonical {} '{}'", entity.getId(), entity.getPrimaryName());
        return entity.getId();
    }

    @Override
    public void save(CanonicalEntity entity) {
        String query = """
                MATCH (c:Canonical {id: $id})
                SET c.primaryName = $primaryName, c.normalizedName = $normalizedName,
                    c.aliases = $aliases, c.attributes = $attributes, c.provenance = $provenance,
                    c.conflicts = $conflicts, c.ingestionIds = $ingestionIds, c.embedding = $embedding,
                    c.blockingKeys = $blockingKeys, c.status = $status, c.mergedInto = $mergedInto,
                    c.lastMergedAt = $lastMergedAt
                RETURN c.id AS id
                """;
        List<Map<String, Object>> rows = writeQuery("save", query, toProperties(entity));
        if (rows.isEmpty()) {
            throw new GraphWriteException("Unknown canonical: " + entity.getId());
        }
    }

    @Override
    public void markMerged(String sourceId, String targetId) {
        String query = """
                MATCH (s:Canonical {id: $sourceId}), (t:Canonical {id: $targetId})
                SET s.status = 'MERGED', s.mergedInto = $targetId, s.blockingKeys = '', s.lastMergedAt = $now
                MERGE (s)-[:MERGED_INTO]->(t)
                RETURN s.id AS id
                """;
        List<Map<String, Object>> rows = writeQuery("markMerged", query, Map.of(
                "sourceId", sourceId,
                "targetId", targetId,
                "now", Instant.now().toString()
        ));
        if (rows.isEmpty()) {
            throw new GraphWriteException("Cannot redirect " + sourceId + " to " + targetId + ": unknown canonical");
        }
    }

    @Override
    public Relationship createRelationship(String subjectId, String predicate, String objectId,
                                           double confidence, String provenance) {
        String query = """
                MATCH (a:Canonical {id: $subjectId}), (b:Canonical {id: $objectId})
                MERGE (a)-[r:RELATED {predicate: $predicate}]->(b)
                ON CREATE SET r.id = $id, r.confidence = $confidence, r.provenance = $provenance,
                              r.createdAt = $createdAt
                ON MATCH SET r.confidence = CASE WHEN r.confidence < $confidence THEN $confidence
                                                 ELSE r.confidence END
                RETURN %s
                """.formatted(RELATIONSHIP_COLUMNS);
        Map<String, Object> params = new HashMap<>();
        params.put("subjectId", subjectId);
        params.put("objectId", objectId);
        params.put("predicate", predicate);
        params.put("id", UUID.randomUUID().toString());
        params.put("confidence", confidence);
        params.put("provenance", provenance != null ? provenance : "");
        params.put("createdAt", Instant.now().toString());
        List<Map<String, Object>> rows = writeQuery("createRelationship", query, params);
        if (rows.isEmpty()) {
            throw new GraphWriteException("Cannot relate unknown canonicals " + subjectId + " -> " + objectId);
        }
        return mapRelationship(rows.get(0));
    }

    @Override
    public void saveRelationship(Relationship relationship) {
        deleteRelationship(relationship.getId());
        String query = """
                MATCH (a:Canonical {id: $subjectId}), (b:Canonical {id: $objectId})
                CREATE (a)-[:RELATED {id: $id, predicate: $predicate, confidence: $confidence,
                                      provenance: $provenance, createdAt: $createdAt}]->(b)
                """;
        write("saveRelationship", query, Map.of(
                "subjectId", relationship.getSubjectId(),
                "objectId", relationship.getObjectId(),
                "id", relationship.getId(),
                "predicate", relationship.getPredicate(),
                "confidence", relationship.getConfidence(),
                "provenance", relationship.getProvenance() != null ? relationship.getProvenance() : "",
                "createdAt", relationship.getCreatedAt().toString()
        ));
    }

    @Override
    public void deleteRelationship(String relationshipId) {
        write("deleteRelationship", """
                MATCH ()-[r:RELATED {id: $id}]->()
                DELETE r
                """, Map.of("id", relationshipId));
    }

    @Override
    public List<Relationship> findRelationships(String canonicalId) {
        String query = """
                MATCH (a:Canonical)-[r:RELATED]->(b:Canonical)
                WHERE a.id = $id OR b.id = $id
                RETURN %s
                ORDER BY r.createdAt, r.id
                """.formatted(RELATIONSHIP_COLUMNS);
        List<Relationship> result = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query, Map.of("id", canonicalId))) {
            result.add(mapRelationship(row));
        }
        return result;
    }

    @Override
    public List<Relationship> repointRelationships(String fromId, String toId) {
        List<Relationship> moved = findRelationships(fromId);
        for (Relationship original : moved) {
            deleteRelationship(original.getId());
            Relationship repointed = original.repoint(fromId, toId);
            if (!repointed.getSubjectId().equals(repointed.getObjectId())) {
                createRelationship(repointed.getSubjectId(), repointed.getPredicate(), repointed.getObjectId(),
                        repointed.getConfidence(), repointed.getProvenance());
            }
        }
        log.debug("Repointed {} relationships from {} to {}", moved.size(), fromId, toId);
        return moved;
    }

    private void write(String operation, String query, Map<String, Object> params) {
        try {
            connection.execute(query, params);
        } catch (RuntimeException e) {
            throw new GraphWriteException("Graph write failed during " + operation + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> writeQuery(String operation, String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new GraphWriteException("Graph write failed during " + operation + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> toProperties(CanonicalEntity entity) {
        Set<String> keys = new LinkedHashSet<>();
        if (entity.isActive()) {
            keys.addAll(blockingKeyStrategy.generateKeys(entity.getNormalizedName()));
            for (Alias alias : entity.getAliases()) {
                keys.addAll(blockingKeyStrategy.generateKeys(alias.normalizedText()));
            }
        }

        List<AliasDocument> aliases = new ArrayList<>();
        for (Alias alias : entity.getAliases()) {
            aliases.add(new AliasDocument(alias.text(), alias.normalizedText(), alias.source(),
                    alias.embedding(), alias.addedAt().toString()));
        }
        List<ProvenanceDocument> provenance = new ArrayList<>();
        for (AttributeProvenance entry : entity.getProvenance()) {
            provenance.add(new ProvenanceDocument(entry.attribute(), entry.priorValue(), entry.newValue(),
                    entry.source(), entry.recordedAt().toString()));
        }
        List<ProvenanceDocument> conflicts = new ArrayList<>();
        for (AttributeConflict conflict : entity.getConflicts()) {
            conflicts.add(new ProvenanceDocument(conflict.attribute(), conflict.existingValue(),
                    conflict.incomingValue(), conflict.source(), conflict.detectedAt().toString()));
        }

        Map<String, Object> params = new HashMap<>();
        params.put("id", entity.getId());
        params.put("type", entity.getType().name());
        params.put("primaryName", entity.getPrimaryName());
        params.put("normalizedName", entity.getNormalizedName());
        params.put("aliases", toJson(aliases));
        params.put("attributes", toJson(entity.getAttributes()));
        params.put("provenance", toJson(provenance));
        params.put("conflicts", toJson(conflicts));
        params.put("ingestionIds", delimited(entity.getIngestionIds()));
        params.put("embedding", entity.hasEmbedding() ? toJson(entity.getEmbedding()) : "");
        params.put("blockingKeys", delimited(keys));
        params.put("status", entity.getStatus().name());
        params.put("mergedInto", entity.getMergedInto() != null ? entity.getMergedInto() : "");
        params.put("createdAt", entity.getCreatedAt().toString());
        params.put("lastMergedAt", entity.getLastMergedAt() != null ? entity.getLastMergedAt().toString() : "");
        return params;
    }

    private List<CanonicalEntity> mapCanonicals(List<Map<String, Object>> rows) {
        List<CanonicalEntity> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(mapCanonical(row));
        }
        return result;
    }

    private CanonicalEntity mapCanonical(Map<String, Object> row) {
        CanonicalEntity.Builder builder = CanonicalEntity.builder()
                .id((String) row.get("id"))
                .type(EntityType.valueOf((String) row.get("type")))
                .primaryName((String) row.get("primaryName"))
                .normalizedName((String) row.get("normalizedName"))
                .status(EntityStatus.valueOf((String) row.get("status")))
                .createdAt(parseInstant(row.get("createdAt")))
                .lastMergedAt(parseInstant(row.get("lastMergedAt")));

        String mergedInto = (String) row.get("mergedInto");
        if (mergedInto != null && !mergedInto.isEmpty()) {
            builder.mergedInto(mergedInto);
        }
        for (AliasDocument doc : orEmpty(fromJson(row.get("aliases"), new TypeReference<List<AliasDocument>>() { }))) {
            builder.alias(new Alias(doc.text(), doc.normalizedText(), doc.source(), doc.embedding(),
                    parseInstant(doc.addedAt())));
        }
        Map<String, Object> attributes = fromJson(row.get("attributes"), new TypeReference<Map<String, Object>>() { });
        if (attributes != null) {
            builder.attributes(attributes);
        }
        List<AttributeProvenance> provenance = new ArrayList<>();
        for (ProvenanceDocument doc : orEmpty(fromJson(row.get("provenance"), new TypeReference<List<ProvenanceDocument>>() { }))) {
            provenance.add(new AttributeProvenance(doc.attribute(), doc.before(), doc.after(), doc.source(),
                    parseInstant(doc.at())));
        }
        builder.provenance(provenance);
        List<AttributeConflict> conflicts = new ArrayList<>();
        for (ProvenanceDocument doc : orEmpty(fromJson(row.get("conflicts"), new TypeReference<List<ProvenanceDocument>>() { }))) {
            conflicts.add(new AttributeConflict(doc.attribute(), doc.before(), doc.after(), doc.source(),
                    parseInstant(doc.at())));
        }
        builder.conflicts(conflicts);
        builder.ingestionIds(splitDelimited((String) row.get("ingestionIds")));

        Object embedding = row.get("embedding");
        if (embedding instanceof String json && !json.isEmpty()) {
            builder.embedding(fromJson(json, new TypeReference<float[]>() { }));
        }
        return builder.build();
    }

    private Relationship mapRelationship(Map<String, Object> row) {
        String provenance = (String) row.get("provenance");
        return Relationship.builder()
                .id((String) row.get("id"))
                .subjectId((String) row.get("subjectId"))
                .predicate((String) row.get("predicate"))
                .objectId((String) row.get("objectId"))
                .confidence(((Number) row.get("confidence")).doubleValue())
                .provenance(provenance != null && !provenance.isEmpty() ? provenance : null)
                .createdAt(parseInstant(row.get("createdAt")))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GraphWriteException("Failed to encode canonical property", e);
        }
    }

    private <T> T fromJson(Object value, TypeReference<T> type) {
        String json = value instanceof String s && !s.isEmpty() ? s : null;
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt canonical property: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static String delimited(Iterable<String> values) {
        StringBuilder sb = new StringBuilder(DELIMITER);
        for (String value : values) {
            sb.append(value).append(DELIMITER);
        }
        return sb.length() == 1 ? "" : sb.toString();
    }

    private static List<String> splitDelimited(String value) {
        List<String> result = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return result;
        }
        for (String part : value.split("\\|")) {
            if (!part.isEmpty()) {
                result.add(part);
            }
        }
        return result;
    }

    private static Instant parseInstant(Object value) {
        if (value instanceof String s && !s.isEmpty()) {
            return Instant.parse(s);
        }
        return null;
    }

    record AliasDocument(String text, String normalizedText, String source, float[] embedding,
                                 String addedAt) {
    }

    record ProvenanceDocument(String attribute, Object before, Object after, String source, String at) {
    }
}
