package com.nexus.resolution.api;

import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandidateValidatorTest {

    private final CandidateValidator validator = new CandidateValidator();

    private static CandidateEntity.Builder valid() {
        return CandidateEntity.builder().name("Marie Girard").type(EntityType.PERSON).ingestionId("ing-1");
    }

    @Test
    @DisplayName("Well-formed candidates pass")
    void testValid() {
        assertDoesNotThrow(() -> validator.validate(valid()
                .attribute("birthDate", "1980-02-11")
                .embedding(new float[]{0.1f, 0.2f})
                .build()));
    }

    @Test
    @DisplayName("Every violation is reported")
    void testAllViolations() {
        CandidateEntity candidate = CandidateEntity.builder().name(" ").build();

        CandidateValidationException e = assertThrows(CandidateValidationException.class,
                () -> validator.validate(candidate));

        assertEquals(3, e.getViolations().size());
        assertTrue(e.getMessage().contains("name must not be blank"));
        assertTrue(e.getMessage().contains("type is required"));
        assertTrue(e.getMessage().contains("ingestionId must not be blank"));
    }

    @Test
    @DisplayName("Names with control characters or excessive length are rejected")
    void testNameRules() {
        assertThrows(CandidateValidationException.class,
                () -> validator.validate(valid().name("Marie\u0000Girard").build()));
        assertThrows(CandidateValidationException.class,
                () -> validator.validate(valid().name("x".repeat(CandidateValidator.MAX_NAME_LENGTH + 1)).build()));
    }

    @Test
    @DisplayName("Attributes without values are rejected")
    void testNullAttribute() {
        CandidateValidationException e = assertThrows(CandidateValidationException.class,
                () -> validator.validate(valid().attribute("employer", null).build()));
        assertEquals(1, e.getViolations().size());
    }

    @Test
    @DisplayName("Empty or non-finite embeddings are rejected")
    void testEmbedding() {
        assertThrows(CandidateValidationException.class,
                () -> validator.validate(valid().embedding(new float[0]).build()));
        assertThrows(CandidateValidationException.class,
                () -> validator.validate(valid().embedding(new float[]{0.1f, Float.NaN}).build()));
    }

    @Test
    @DisplayName("Null candidate is rejected")
    void testNull() {
        assertThrows(CandidateValidationException.class, () -> validator.validate(null));
    }
}
