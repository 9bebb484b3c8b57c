package com.nexus.resolution.adjudication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strict parser for adjudicator responses:
 * <pre>
 * {"verdicts": [{"canonicalId": "...", "match": true, "confidence": 0.92, "reason": "..."}]}
 * </pre>
 * Exactly one verdict per contender is required. Any deviation (invalid JSON, unknown or
 * missing fields, wrong types, confidence outside [0, 1], unknown or repeated contender ids)
 * yields a single {@link Verdict.Kind#MALFORMED} verdict.
 */
public class AdjudicationResponseParser {

    private static final Set<String> VERDICT_FIELDS = Set.of("canonicalId", "match", "confidence", "reason");

    private final ObjectMapper objectMapper;

    public AdjudicationResponseParser() {
        this(new ObjectMapper());
    }

    public AdjudicationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param contenderIds canonical ids the request asked about
     * @return verdicts in the order of {@code contenderIds}, or a single malformed verdict
     */
    public List<Verdict> parse(String raw, List<String> contenderIds) {
        if (raw == null || raw.isBlank()) {
            return List.of(Verdict.malformed("empty response"));
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return List.of(Verdict.malformed("invalid JSON: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject() || root.size() != 1 || !root.has("verdicts")) {
            return List.of(Verdict.malformed("expected an object with a single 'verdicts' field"));
        }
        JsonNode array = root.get("verdicts");
        if (!array.isArray()) {
            return List.of(Verdict.malformed("'verdicts' is not an array"));
        }

        Map<String, Verdict> byId = new LinkedHashMap<>();
        for (JsonNode node : array) {
            String problem = validate(node, contenderIds);
            if (problem != null) {
                return List.of(Verdict.malformed(problem));
            }
            String id = node.get("canonicalId").textValue();
            if (byId.containsKey(id)) {
                return List.of(Verdict.malformed("duplicate verdict for " + id));
            }
            double confidence = node.get("confidence").doubleValue();
            String reason = node.get("reason").textValue();
            byId.put(id, node.get("match").booleanValue()
                    ? Verdict.matched(id, confidence, reason)
                    : Verdict.unmatched(id, confidence, reason));
        }

        List<Verdict> ordered = new ArrayList<>(contenderIds.size());
        for (String id : contenderIds) {
            Verdict verdict = byId.get(id);
            if (verdict == null) {
                return List.of(Verdict.malformed("missing verdict for " + id));
            }
            ordered.add(verdict);
        }
        return ordered;
    }

    private static String validate(JsonNode node, List<String> contenderIds) {
        if (!node.isObject()) {
            return "verdict is not an object";
        }
        Set<String> fields = new HashSet<>();
        Iterator<String> names = node.fieldNames();
        names.forEachRemaining(fields::add);
        if (!fields.equals(VERDICT_FIELDS)) {
            return "verdict fields must be exactly " + VERDICT_FIELDS + ", got " + fields;
        }
        if (!node.get("canonicalId").isTextual()) {
            return "canonicalId is not a string";
        }
        if (!contenderIds.contains(node.get("canonicalId").textValue())) {
            return "unknown contender " + node.get("canonicalId").textValue();
        }
        if (!node.get("match").isBoolean()) {
            return "match is not a boolean";
        }
        JsonNode confidence = node.get("confidence");
        if (!confidence.isNumber() || Double.isNaN(confidence.doubleValue())
                || confidence.doubleValue() < 0.0 || confidence.doubleValue() > 1.0) {
            return "confidence is not a number in [0, 1]";
        }
        if (!node.get("reason").isTextual()) {
            return "reason is not a string";
        }
        return null;
    }
}
