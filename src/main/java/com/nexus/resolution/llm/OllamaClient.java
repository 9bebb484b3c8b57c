package com.nexus.resolution.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal client for a local Ollama server (default: http://localhost:11434).
 *
 * <p>Requests are sent to {@code /api/generate} with streaming disabled and, when asked,
 * {@code format: "json"} so the model is constrained to emit a JSON document.</p>
 *
 * <pre>
 * OllamaClient client = OllamaClient.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaClient {
    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaClient(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Sends one prompt and returns the model's response text.
     *
     * @param jsonFormat constrain the output to JSON
     * @throws OllamaException on non-200 responses, I/O errors or an unreadable envelope
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public String generate(String prompt, boolean jsonFormat) throws InterruptedException {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(
                    new GenerateRequest(model, prompt, false, jsonFormat ? "json" : null));
        } catch (JsonProcessingException e) {
            throw new OllamaException("Failed to encode Ollama request", e);
        }

        log.debug("ollama.generate model={} promptLength={}", model, prompt.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OllamaException("Ollama call failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw new OllamaException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        try {
            GenerateResponse generated = objectMapper.readValue(response.body(), GenerateResponse.class);
            String text = generated.response() != null ? generated.response() : "";
            log.debug("ollama.response length={}", text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new OllamaException("Unreadable Ollama envelope", e);
        }
    }

    /**
     * Probes {@code /api/tags}; any failure means unavailable.
     */
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("ollama.unavailable cause={}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getModel() {
        return model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaClient build() {
            return new OllamaClient(this);
        }
    }

    // Request/Response DTOs for the Ollama API
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record GenerateRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
