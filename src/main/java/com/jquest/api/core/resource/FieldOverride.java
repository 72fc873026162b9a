package com.jquest.api.core.resource;

/**
 * Replaces the extracted value of one field.
 * The bundle data already holds the raw value and every field dehydrated before it.
 */
@FunctionalInterface
public interface FieldOverride {

    Object dehydrate(Bundle bundle);
}
