package com.jquest.api.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorResponse Tests")
class ErrorResponseTest {

    @Test
    @DisplayName("Should fill status, code and path")
    void shouldCreateWithCode() {
        // When
        ErrorResponse response = new ErrorResponse(404, "Not Found", ErrorCode.UNKNOWN_RESOURCE,
            "No resource registered with name: quest", "/api/v1/quest");

        // Then
        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getError()).isEqualTo("Not Found");
        assertThat(response.getCode()).isEqualTo("UNKNOWN_RESOURCE");
        assertThat(response.getMessage()).isEqualTo("No resource registered with name: quest");
        assertThat(response.getPath()).isEqualTo("/api/v1/quest");
        assertThat(response.getTimestamp()).isNotNull();
        assertThat(response.getFieldErrors()).isNull();
    }

    @Test
    @DisplayName("Should fall back to the code's default message")
    void shouldUseDefaultMessage() {
        // When
        ErrorResponse response = new ErrorResponse(409, "Conflict", ErrorCode.CONSTRAINT_VIOLATION,
            null, "/api/v1/instance");

        // Then
        assertThat(response.getMessage()).isEqualTo(ErrorCode.CONSTRAINT_VIOLATION.getDefaultMessage());
    }

    @Test
    @DisplayName("Should carry field errors")
    void shouldCreateWithFieldErrors() {
        // Given
        List<ErrorResponse.FieldError> fieldErrors = List.of(
            new ErrorResponse.FieldError("oauths", null, "The 'oauths' field must be an object or a list of objects"),
            new ErrorResponse.FieldError("email", "alice@example.org", "The 'email' field does not allow filtering")
        );

        // When
        ErrorResponse response = new ErrorResponse(400, "Bad Request", ErrorCode.INVALID_PAYLOAD,
            "Invalid payload", "/api/v1/user", fieldErrors);

        // Then
        assertThat(response.getFieldErrors()).hasSize(2);
        assertThat(response.getFieldErrors().get(0).getField()).isEqualTo("oauths");
        assertThat(response.getDetails()).isNull();
    }
}
