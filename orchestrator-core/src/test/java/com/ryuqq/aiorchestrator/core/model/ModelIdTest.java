package com.ryuqq.aiorchestrator.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModelId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModelIdTest {

    @Test
    void of_ValidValue_CreatesModelId() {
        // Given
        String value = "llama2";

        // When
        ModelId modelId = ModelId.of(value);

        // Then
        assertEquals(value, modelId.getValue());
    }

    @Test
    void of_OllamaTagWithColonAndDot_CreatesModelId() {
        // When
        ModelId modelId = ModelId.of("llama3.2:latest");

        // Then
        assertEquals("llama3.2:latest", modelId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ModelId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("  "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "m".repeat(129);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ModelId.of(value)
        );
        assertTrue(exception.getMessage().contains("128"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("model with space"));
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("model/slash"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        ModelId first = ModelId.of("spam-detector");
        ModelId second = ModelId.of("spam-detector");

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void toString_ReturnsFormattedString() {
        assertEquals("ModelId{llava}", ModelId.of("llava").toString());
    }
}
