package io.intellixity.tabula.shape;

import java.util.Objects;

/**
 * Namespaced key/value metadata attached to a field.
 * <p>
 * {@code namespace} and {@code value} may be null.
 */
public record Attribute(String namespace, String key, Object value) {
  /** Namespace of attributes that drive schema derivation. */
  public static final String SCHEMA_NAMESPACE = "psql";
  /** Key marking a field as the table's primary key. */
  public static final String PRIMARY_KEY = "primary_key";

  public Attribute {
    Objects.requireNonNull(key, "key");
  }

  public static Attribute of(String namespace, String key) {
    return new Attribute(namespace, key, null);
  }

  public static Attribute primaryKey() {
    return new Attribute(SCHEMA_NAMESPACE, PRIMARY_KEY, null);
  }
}
