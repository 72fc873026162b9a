package com.jquest.api.core.resource;

/**
 * Produces the raw value of a field from the object held by a bundle.
 */
@FunctionalInterface
public interface FieldExtractor {

    Object extract(Bundle bundle);
}
