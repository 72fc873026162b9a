package com.jquest.api.dto;

public enum ErrorCode {
    // General errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "Internal server error occurred"),
    BAD_REQUEST("BAD_REQUEST", "Bad request"),
    UNAUTHORIZED("UNAUTHORIZED", "Unauthorized access"),
    FORBIDDEN("FORBIDDEN", "Access forbidden"),

    // Resource errors
    UNKNOWN_RESOURCE("UNKNOWN_RESOURCE", "Resource not found"),
    ENTITY_NOT_FOUND("ENTITY_NOT_FOUND", "Entity not found"),
    RELATIONSHIP_ERROR("RELATIONSHIP_ERROR", "Related object could not be resolved"),

    // Request errors
    INVALID_FILTER("INVALID_FILTER", "Filtering is not allowed on this field"),
    INVALID_PAYLOAD("INVALID_PAYLOAD", "Invalid request payload"),
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),

    // Data access errors
    CONSTRAINT_VIOLATION("CONSTRAINT_VIOLATION", "Data constraint violation");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
