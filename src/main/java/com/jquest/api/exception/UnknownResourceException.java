package com.jquest.api.exception;

/**
 * Thrown when a request addresses a resource name that is not registered.
 */
public class UnknownResourceException extends RuntimeException {

    private final String resourceName;

    public UnknownResourceException(String resourceName) {
        super("No resource registered with name: " + resourceName);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
