package io.intellixity.tabula.shape;

import java.util.Objects;

/** Optional wrapper around {@code inner}. */
public record OptionDef(Shape inner) implements ShapeDef {
  public OptionDef {
    Objects.requireNonNull(inner, "inner");
  }

  @Override public String id() { return "option"; }
}
