package io.intellixity.tabula.shape;

import java.util.Objects;

/** Fixed-length array of {@code length} elements. */
public record ArrayDef(Shape element, int length) implements ShapeDef {
  public ArrayDef {
    Objects.requireNonNull(element, "element");
    if (length < 0) throw new IllegalArgumentException("Array length must be >= 0: " + length);
  }

  @Override public String id() { return "array"; }
}
