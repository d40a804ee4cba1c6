package io.intellixity.tabula.diff;

import io.intellixity.tabula.schema.Column;

import java.util.List;
import java.util.Objects;

/**
 * Column-level alteration of an existing table.\n
 *
 * {@code altered} columns carry their new type and nullability.
 */
public record TableChange(String table, List<Column> added, List<Column> altered, List<String> dropped) {
  public TableChange {
    Objects.requireNonNull(table, "table");
    added = added == null ? List.of() : List.copyOf(added);
    altered = altered == null ? List.of() : List.copyOf(altered);
    dropped = dropped == null ? List.of() : List.copyOf(dropped);
  }

  public boolean isEmpty() {
    return added.isEmpty() && altered.isEmpty() && dropped.isEmpty();
  }
}
