package com.jquest.api.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InputSanitizer Tests")
class InputSanitizerTest {

    private InputSanitizer inputSanitizer;

    @BeforeEach
    void setUp() {
        inputSanitizer = new InputSanitizer();
    }

    @Test
    @DisplayName("Should trim filter values and strip control characters")
    void shouldCleanFilterValues() {
        // Given
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("username", "  alice  ");
        filters.put("consumer", "face\u0001book\u001F");

        // When
        Map<String, String> result = inputSanitizer.sanitizeFilters(filters);

        // Then
        assertThat(result)
            .hasSize(2)
            .containsEntry("username", "alice")
            .containsEntry("consumer", "facebook");
    }

    @Test
    @DisplayName("Should leave the given filters map untouched")
    void shouldCopyFilters() {
        // Given
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("slug", " main ");

        // When
        inputSanitizer.sanitizeFilters(filters);

        // Then
        assertThat(filters).containsEntry("slug", " main ");
    }

    @Test
    @DisplayName("Should return an empty map when filters are null")
    void shouldReturnEmptyMapForNullFilters() {
        // When
        Map<String, String> result = inputSanitizer.sanitizeFilters(null);

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("Should return null and empty strings unchanged")
    void shouldKeepNullAndEmpty() {
        // When & Then
        assertThat(inputSanitizer.sanitizeString(null)).isNull();
        assertThat(inputSanitizer.sanitizeString("")).isEmpty();
    }

    @Test
    @DisplayName("Should truncate long values when logging")
    void shouldTruncateForLogging() {
        // Given
        String longString = "a".repeat(2000);

        // When
        String result = inputSanitizer.sanitizeForLogging(longString);

        // Then
        assertThat(result)
            .hasSize(1003)
            .endsWith("...");
    }

    @Test
    @DisplayName("Should mask passwords and tokens in query strings and JSON bodies")
    void shouldMaskSecrets() {
        // When
        String query = inputSanitizer.sanitizeForLogging("password=secret123&token=abc123");
        String json = inputSanitizer.sanitizeForLogging("{\"username\":\"bob\",\"password\" : \"hunter2\"}");

        // Then
        assertThat(query).isEqualTo("password=***&token=***");
        assertThat(json)
            .contains("\"username\":\"bob\"")
            .contains("\"password\":\"***\"")
            .doesNotContain("hunter2");
    }
}
