package com.nexus.resolution.adjudication;

import com.nexus.resolution.llm.OllamaClient;
import com.nexus.resolution.llm.OllamaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OllamaAdjudicatorTest {

    @Mock
    private OllamaClient client;

    private OllamaAdjudicator adjudicator;

    @BeforeEach
    void setUp() {
        adjudicator = new OllamaAdjudicator(client);
    }

    private static AdjudicationRequest request() {
        CandidateProfile candidate = new CandidateProfile("ing-1", "Marie Eve G.", "Person",
                List.of(), Map.of("city", "Montreal"));
        CandidateProfile contender = new CandidateProfile("c1", "Marie-Eve Girard", "Person",
                List.of("M. E. Girard"), Map.of());
        return new AdjudicationRequest(candidate, List.of(contender), "Marie Eve G. spoke in Montreal.");
    }

    @Test
    @DisplayName("Prompt lists the candidate, each contender id and the response shape")
    void promptContents() {
        String prompt = adjudicator.buildPrompt(request());

        assertTrue(prompt.contains("name: Marie Eve G."));
        assertTrue(prompt.contains("canonicalId: c1"));
        assertTrue(prompt.contains("aliases: M. E. Girard"));
        assertTrue(prompt.contains("{\"city\":\"Montreal\"}"));
        assertTrue(prompt.contains("Marie Eve G. spoke in Montreal."));
        assertTrue(prompt.contains("{\"verdicts\":["));
    }

    @Test
    @DisplayName("Raw model output is returned unparsed in JSON mode")
    void returnsRawText() throws Exception {
        when(client.generate(anyString(), eq(true))).thenReturn("{\"verdicts\":[]}");

        assertEquals("{\"verdicts\":[]}", adjudicator.adjudicate(request()));
    }

    @Test
    @DisplayName("Client failures surface as adjudication errors")
    void clientFailure() throws Exception {
        when(client.generate(anyString(), eq(true))).thenThrow(new OllamaException("Ollama returned status 500"));

        AdjudicationException e = assertThrows(AdjudicationException.class, () -> adjudicator.adjudicate(request()));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    @DisplayName("Name includes the model")
    void nameIncludesModel() {
        when(client.getModel()).thenReturn("llama3.2");
        assertEquals("Ollama/llama3.2", adjudicator.getName());
    }

    @Test
    @DisplayName("Builder defaults use llama3.2")
    void clientDefaults() {
        assertEquals("llama3.2", OllamaClient.builder().build().getModel());
        assertEquals("mistral", OllamaClient.builder().model("mistral").build().getModel());
    }
}
