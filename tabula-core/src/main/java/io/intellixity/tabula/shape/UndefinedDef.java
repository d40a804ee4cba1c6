package io.intellixity.tabula.shape;

public record UndefinedDef() implements ShapeDef {
  @Override public String id() { return "undefined"; }
}
