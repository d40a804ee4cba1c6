package io.intellixity.tabula.schema;

import java.util.Objects;

/**
 * Table column.\n
 *
 * {@code dataType} is never {@link Nullable}; nullability is carried by the flag.
 */
public record Column(String name, SqlType dataType, boolean nullable) {
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dataType, "dataType");
    if (dataType instanceof Nullable n) {
      dataType = n.inner();
      nullable = true;
    }
  }

  /** Type including nullability, i.e. {@code Nullable(dataType)} for nullable columns. */
  public SqlType effectiveType() {
    return nullable ? SqlType.nullable(dataType) : dataType;
  }
}
