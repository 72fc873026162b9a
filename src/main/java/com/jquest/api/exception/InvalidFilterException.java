package com.jquest.api.exception;

/**
 * A list request used a filter the resource does not allow, or a value that cannot be
 * converted to the filtered attribute's type.
 */
public class InvalidFilterException extends RuntimeException {

    private final String filter;

    public InvalidFilterException(String filter, String message) {
        super(message);
        this.filter = filter;
    }

    public String getFilter() {
        return filter;
    }
}
