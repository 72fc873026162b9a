package com.jquest.api.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an entity field as optional in write payloads.
 * Resource field construction ignores this marker; it is applied afterwards so the
 * published field descriptor reports {@code blank = true}.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface BlankAllowed {
}
