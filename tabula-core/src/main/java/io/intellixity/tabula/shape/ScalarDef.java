package io.intellixity.tabula.shape;

public record ScalarDef() implements ShapeDef {
  @Override public String id() { return "scalar"; }
}
