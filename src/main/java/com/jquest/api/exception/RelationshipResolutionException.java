package com.jquest.api.exception;

/**
 * A related field could not be rendered while projecting an object.
 * Not recoverable at request level; surfaces as a server error.
 */
public class RelationshipResolutionException extends RuntimeException {

    public RelationshipResolutionException(String message) {
        super(message);
    }
}
