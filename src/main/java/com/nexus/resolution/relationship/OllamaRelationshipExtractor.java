package com.nexus.resolution.relationship;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.llm.OllamaClient;
import com.nexus.resolution.llm.OllamaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Asks a local Ollama model which relationships the source text states between the resolved
 * entities. The model answers with entity names, which are mapped back to canonical ids;
 * unknown names and malformed entries are dropped. Failures yield an empty list.
 */
public class OllamaRelationshipExtractor implements RelationshipExtractor {
    private static final Logger log = LoggerFactory.getLogger(OllamaRelationshipExtractor.class);

    private final OllamaClient client;
    private final ObjectMapper objectMapper;

    public OllamaRelationshipExtractor(OllamaClient client) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<RelationshipCandidate> extract(List<CanonicalEntity> entities, String sourceContext) {
        Map<String, String> idsByName = new HashMap<>();
        for (CanonicalEntity entity : entities) {
            idsByName.putIfAbsent(entity.getPrimaryName().toLowerCase(Locale.ROOT), entity.getId());
        }
        try {
            String raw = client.generate(buildPrompt(entities, sourceContext), true);
            return parse(raw, idsByName);
        } catch (OllamaException e) {
            log.warn("relationship.extraction_failed cause={}", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("relationship.extraction_interrupted");
            return List.of();
        }
    }

    @Override
    public String getName() {
        return "Ollama/" + client.getModel();
    }

    String buildPrompt(List<CanonicalEntity> entities, String sourceContext) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You extract relationships between known entities from text.\n\n");
        prompt.append("ENTITIES:\n");
        for (CanonicalEntity entity : entities) {
            prompt.append("- ").append(entity.getPrimaryName())
                    .append(" (").append(entity.getType().getLabel()).append(")\n");
        }
        prompt.append("\nTEXT:\n\"\"\"\n").append(sourceContext).append("\n\"\"\"\n\n");
        prompt.append("""
                Instructions:
                1. Only report relationships the text states between two of the listed entities.
                2. Use the entity names exactly as listed.
                3. "predicate" is a short UPPER_SNAKE_CASE label such as WORKS_FOR or LOCATED_IN.
                4. "confidence" is a number from 0.0 to 1.0.
                5. Respond with JSON only, in exactly this shape:
                {"relationships":[{"subject":"<name>","predicate":"<LABEL>","object":"<name>","confidence":0.0}]}
                """);
        return prompt.toString();
    }

    List<RelationshipCandidate> parse(String raw, Map<String, String> idsByName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            log.warn("relationship.response_malformed cause={}", e.getOriginalMessage());
            return List.of();
        }
        JsonNode relationships = root == null ? null : root.get("relationships");
        if (relationships == null || !relationships.isArray()) {
            log.warn("relationship.response_malformed cause=missing relationships array");
            return List.of();
        }

        List<RelationshipCandidate> candidates = new ArrayList<>();
        for (JsonNode node : relationships) {
            JsonNode subject = node.get("subject");
            JsonNode predicate = node.get("predicate");
            JsonNode object = node.get("object");
            JsonNode confidence = node.get("confidence");
            if (subject == null || !subject.isTextual() || object == null || !object.isTextual()
                    || predicate == null || !predicate.isTextual() || predicate.asText().isBlank()
                    || confidence == null || !confidence.isNumber()) {
                log.debug("Skipping malformed relationship entry: {}", node);
                continue;
            }
            String subjectId = idsByName.get(subject.asText().trim().toLowerCase(Locale.ROOT));
            String objectId = idsByName.get(object.asText().trim().toLowerCase(Locale.ROOT));
            double value = confidence.asDouble();
            if (subjectId == null || objectId == null || value < 0.0 || value > 1.0) {
                log.debug("Skipping relationship with unknown entity or bad confidence: {}", node);
                continue;
            }
            candidates.add(new RelationshipCandidate(subjectId, predicate.asText(), objectId, value));
        }
        return candidates;
    }
}
