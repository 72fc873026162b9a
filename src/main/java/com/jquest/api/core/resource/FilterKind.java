package com.jquest.api.core.resource;

/**
 * Filtering allowed on a published field.
 */
public enum FilterKind {
    /** Exact match on the field itself. */
    EXACT,
    /** Exact match on the field or on any attribute reached through it, e.g. {@code user__username}. */
    EXACT_WITH_RELATIONS
}
