package io.intellixity.tabula.schema;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table definition derived from a record shape.
 * <p>
 * {@code primaryKey} is null when no field is marked as primary key; otherwise it is one of
 * {@link #columns()}.
 */
@JsonSerialize(using = TableJsonSerializer.class)
public record Table(String name, List<Column> columns, Column primaryKey) {
  public Table {
    Objects.requireNonNull(name, "name");
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (primaryKey != null && !columns.contains(primaryKey)) {
      throw new IllegalArgumentException("Primary key column '" + primaryKey.name() + "' is not a column of " + name);
    }
  }

  public Optional<Column> primaryKeyColumn() {
    return Optional.ofNullable(primaryKey);
  }

  public Optional<Column> column(String columnName) {
    for (Column c : columns) {
      if (c.name().equals(columnName)) return Optional.of(c);
    }
    return Optional.empty();
  }
}
