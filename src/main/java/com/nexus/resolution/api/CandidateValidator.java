package com.nexus.resolution.api;

import com.nexus.resolution.core.model.CandidateEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks a candidate before it enters the pipeline.
 */
public class CandidateValidator {

    public static final int MAX_NAME_LENGTH = 512;

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    /**
     * @throws CandidateValidationException listing every violation
     */
    public void validate(CandidateEntity candidate) {
        if (candidate == null) {
            throw new CandidateValidationException(List.of("candidate is null"));
        }
        List<String> violations = new ArrayList<>();

        String name = candidate.name();
        if (name == null || name.isBlank()) {
            violations.add("name must not be blank");
        } else {
            if (name.length() > MAX_NAME_LENGTH) {
                violations.add("name exceeds " + MAX_NAME_LENGTH + " characters");
            }
            if (CONTROL_CHARS.matcher(name).find()) {
                violations.add("name contains control characters");
            }
        }
        if (candidate.type() == null) {
            violations.add("type is required");
        }
        if (candidate.ingestionId() == null || candidate.ingestionId().isBlank()) {
            violations.add("ingestionId must not be blank");
        }
        for (Map.Entry<String, Object> attribute : candidate.attributes().entrySet()) {
            if (attribute.getKey() == null || attribute.getKey().isBlank()) {
                violations.add("attribute keys must not be blank");
                break;
            }
            if (attribute.getValue() == null) {
                violations.add("attribute '" + attribute.getKey() + "' has no value");
            }
        }
        float[] embedding = candidate.embedding();
        if (embedding != null) {
            if (embedding.length == 0) {
                violations.add("embedding must not be empty");
            }
            for (float component : embedding) {
                if (!Float.isFinite(component)) {
                    violations.add("embedding contains a non-finite component");
                    break;
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new CandidateValidationException(violations);
        }
    }
}
