package io.intellixity.tabula.schema;

import java.util.Objects;

public record Nullable(SqlType inner) implements SqlType {
  public Nullable {
    Objects.requireNonNull(inner, "inner");
    if (inner instanceof Nullable) throw new IllegalArgumentException("Nested Nullable: " + inner.id());
  }

  @Override
  public String id() {
    return "nullable(" + inner.id() + ")";
  }
}
