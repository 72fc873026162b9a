package com.jquest.api.exception;

import java.util.Collections;
import java.util.List;

/**
 * A write payload was rejected before or while being hydrated into an entity.
 */
public class InvalidPayloadException extends RuntimeException {

    private final String field;
    private final List<String> errors;

    public InvalidPayloadException(String field, String message) {
        super(message);
        this.field = field;
        this.errors = List.of(message);
    }

    public InvalidPayloadException(List<String> errors) {
        super(String.join(", ", errors));
        this.field = null;
        this.errors = Collections.unmodifiableList(errors);
    }

    /**
     * @return the offending field, or null when the errors are not tied to one field
     */
    public String getField() {
        return field;
    }

    public List<String> getErrors() {
        return errors;
    }
}
