package io.intellixity.sqlchain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps the columns of a nested object onto the same row.\n
 * Nested columns are named {@code prefix + nestedColumn}; the default prefix is empty.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.FIELD})
public @interface Decompose {
  String value() default "";
}
