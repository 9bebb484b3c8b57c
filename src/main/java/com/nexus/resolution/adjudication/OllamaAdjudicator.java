package com.nexus.resolution.adjudication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexus.resolution.llm.OllamaClient;
import com.nexus.resolution.llm.OllamaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Adjudicator backed by a local Ollama model.
 *
 * <p>The prompt lists the candidate and each contender with its canonical id and asks for a
 * {@code {"verdicts":[...]}} document. The raw text is returned unparsed.</p>
 *
 * <pre>
 * Adjudicator adjudicator = new OllamaAdjudicator(OllamaClient.builder().model("llama3.2").build());
 * </pre>
 */
public class OllamaAdjudicator implements Adjudicator {
    private static final Logger log = LoggerFactory.getLogger(OllamaAdjudicator.class);

    private final OllamaClient client;
    private final ObjectMapper objectMapper;

    public OllamaAdjudicator(OllamaClient client) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String adjudicate(AdjudicationRequest request) {
        log.debug("adjudication.request candidate='{}' contenders={}",
                request.candidate().name(), request.contenders().size());
        try {
            return client.generate(buildPrompt(request), true);
        } catch (OllamaException e) {
            throw new AdjudicationException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdjudicationException("Interrupted while waiting for Ollama", e);
        }
    }

    @Override
    public String getName() {
        return "Ollama/" + client.getModel();
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }

    String buildPrompt(AdjudicationRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an entity resolution expert. Decide whether the CANDIDATE refers to the same real-world ")
                .append(request.candidate().type())
                .append(" as any of the CONTENDERS.\n\n");

        prompt.append("CANDIDATE:\n").append(describe(request.candidate())).append("\n");

        prompt.append("CONTENDERS:\n");
        for (CandidateProfile contender : request.contenders()) {
            prompt.append("- canonicalId: ").append(contender.id()).append("\n");
            prompt.append(describe(contender));
        }
        prompt.append("\n");

        if (!request.sourceExcerpt().isBlank()) {
            prompt.append("SOURCE EXCERPT:\n\"\"\"\n").append(request.sourceExcerpt()).append("\n\"\"\"\n\n");
        }

        prompt.append("""
                Instructions:
                1. Give exactly one verdict for every contender, using its canonicalId.
                2. "match" is true only if the candidate and the contender are the same entity.
                3. "confidence" is a number from 0.0 to 1.0.
                4. Respond with JSON only, in exactly this shape:
                {"verdicts":[{"canonicalId":"<id>","match":true,"confidence":0.0,"reason":"<short reason>"}]}
                """);
        return prompt.toString();
    }

    private String describe(CandidateProfile profile) {
        StringBuilder out = new StringBuilder();
        out.append("  name: ").append(profile.name()).append("\n");
        if (!profile.aliases().isEmpty()) {
            out.append("  aliases: ").append(String.join(", ", profile.aliases())).append("\n");
        }
        if (!profile.attributes().isEmpty()) {
            out.append("  attributes: ").append(toJson(profile)).append("\n");
        }
        return out.toString();
    }

    private String toJson(CandidateProfile profile) {
        try {
            return objectMapper.writeValueAsString(profile.attributes());
        } catch (JsonProcessingException e) {
            log.debug("adjudication.attributes_unserializable id={} cause={}", profile.id(), e.getMessage());
            return profile.attributes().toString();
        }
    }
}
