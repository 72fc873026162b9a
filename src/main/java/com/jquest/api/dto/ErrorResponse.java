package com.jquest.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Body returned for every failed API call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private LocalDateTime timestamp;
    /** HTTP status code of the error. */
    private int status;
    /** Reason phrase of the status. */
    private String error;
    /** Stable machine-readable code, see {@link ErrorCode}. */
    private String code;
    private String message;
    /** Request path that caused the error. */
    private String path;
    /** Field-level problems of a rejected payload or filter. */
    private List<FieldError> fieldErrors;
    private Map<String, Object> details;

    /**
     * A problem with one field of a payload or one filter of a query.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }

    public ErrorResponse(int status, String error, ErrorCode code, String message, String path) {
        this.timestamp = LocalDateTime.now();
        this.status = status;
        this.error = error;
        this.code = code.getCode();
        this.message = message != null ? message : code.getDefaultMessage();
        this.path = path;
    }

    public ErrorResponse(int status, String error, ErrorCode code, String message, String path,
                         List<FieldError> fieldErrors) {
        this(status, error, code, message, path);
        this.fieldErrors = fieldErrors;
    }
}
