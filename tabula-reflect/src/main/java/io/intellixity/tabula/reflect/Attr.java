package io.intellixity.tabula.reflect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Free-form namespaced attribute carried into the derived shape.\n
 *
 * An empty {@code ns} means "no namespace"; an empty {@code value} means "no value".
 * {@code @Attr(ns = "psql", key = "primary_key")} is equivalent to {@link PrimaryKey}.
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(Attrs.class)
public @interface Attr {
  String ns() default "";

  String key();

  String value() default "";
}
