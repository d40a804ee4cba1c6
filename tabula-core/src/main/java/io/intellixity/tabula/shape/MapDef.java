package io.intellixity.tabula.shape;

import java.util.Objects;

/** Associative container from {@code key} to {@code value}. */
public record MapDef(Shape key, Shape value) implements ShapeDef {
  public MapDef {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  @Override public String id() { return "map"; }
}
