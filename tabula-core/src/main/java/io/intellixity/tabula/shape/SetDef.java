package io.intellixity.tabula.shape;

import java.util.Objects;

public record SetDef(Shape element) implements ShapeDef {
  public SetDef {
    Objects.requireNonNull(element, "element");
  }

  @Override public String id() { return "set"; }
}
