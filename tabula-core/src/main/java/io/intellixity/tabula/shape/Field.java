package io.intellixity.tabula.shape;

import java.util.List;
import java.util.Objects;

/** Named member of a record or variant. Attribute order carries no meaning. */
public record Field(String name, Shape shape, List<Attribute> attributes) {
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(shape, "shape");
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public Field(String name, Shape shape) {
    this(name, shape, List.of());
  }
}
