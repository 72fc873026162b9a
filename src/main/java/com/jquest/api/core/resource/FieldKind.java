package com.jquest.api.core.resource;

/**
 * How a resource field obtains and renders its value.
 */
public enum FieldKind {
    /** Plain attribute of the object, published as is. */
    ATTRIBUTE,
    /** Single related object, published as a resource URI or a nested representation. */
    TO_ONE,
    /** Collection of related objects, published as a list of URIs or nested representations. */
    TO_MANY
}
