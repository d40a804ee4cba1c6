package io.intellixity.tabula.convert;

import io.intellixity.tabula.shape.Attribute;
import io.intellixity.tabula.shape.Field;

/**
 * Detects the primary-key marker on a field.\n
 *
 * A field is a primary key iff one of its attributes has namespace {@value Attribute#SCHEMA_NAMESPACE}
 * and key {@value Attribute#PRIMARY_KEY}, both compared exactly (case-sensitive).
 * Attributes without a namespace never match.
 */
public final class AttributeResolver {
  public boolean isPrimaryKey(Field field) {
    for (Attribute a : field.attributes()) {
      if (Attribute.SCHEMA_NAMESPACE.equals(a.namespace()) && Attribute.PRIMARY_KEY.equals(a.key())) {
        return true;
      }
    }
    return false;
  }
}
