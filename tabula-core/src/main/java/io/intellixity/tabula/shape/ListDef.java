package io.intellixity.tabula.shape;

import java.util.Objects;

public record ListDef(Shape element) implements ShapeDef {
  public ListDef {
    Objects.requireNonNull(element, "element");
  }

  @Override public String id() { return "list"; }
}
