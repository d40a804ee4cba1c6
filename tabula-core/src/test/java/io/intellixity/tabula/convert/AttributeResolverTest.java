package io.intellixity.tabula.convert;

import io.intellixity.tabula.shape.Attribute;
import io.intellixity.tabula.shape.Field;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.tabula.shape.Shapes.*;
import static org.junit.jupiter.api.Assertions.*;

final class AttributeResolverTest {
  private final AttributeResolver resolver = new AttributeResolver();

  @Test
  void matchesNamespacedPrimaryKey() {
    assertTrue(resolver.isPrimaryKey(primaryKey("id", u64())));
    assertTrue(resolver.isPrimaryKey(field("id", u64(), new Attribute("psql", "primary_key", true))));
  }

  @Test
  void fieldWithoutAttributesIsNotPrimaryKey() {
    assertFalse(resolver.isPrimaryKey(new Field("id", u64())));
  }

  @Test
  void missingNamespaceDoesNotMatch() {
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of(null, "primary_key"))));
  }

  @Test
  void matchingIsExactAndCaseSensitive() {
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of("Psql", "primary_key"))));
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of("psql", "PRIMARY_KEY"))));
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of("psq", "primary_key"))));
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of("psql", "primary"))));
    assertFalse(resolver.isPrimaryKey(field("id", u64(), Attribute.of("psql ", "primary_key"))));
  }

  @Test
  void scansAllAttributes() {
    Field f = new Field("id", u64(), List.of(
        Attribute.of("serde", "rename"),
        Attribute.of(null, "doc"),
        Attribute.primaryKey()));
    assertTrue(resolver.isPrimaryKey(f));
  }
}
