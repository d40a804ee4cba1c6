package io.intellixity.tabula.shape;

import java.util.List;
import java.util.Objects;

/** One alternative of a tagged type; unit variants have no fields. */
public record Variant(String name, List<Field> fields) {
  public Variant {
    Objects.requireNonNull(name, "name");
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
