package io.intellixity.tabula.diff;

import io.intellixity.tabula.convert.ShapeInspector;
import io.intellixity.tabula.convert.TableBuilder;
import io.intellixity.tabula.schema.Column;
import io.intellixity.tabula.shape.Field;
import io.intellixity.tabula.shape.PrimitiveType;
import io.intellixity.tabula.shape.Shape;
import io.intellixity.tabula.shape.ShapeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plans a {@link TableChange} from a record-to-record {@link ShapeDiff}.
 * <p>
 * Type changes are accepted only between numeric and textual primitives (in any combination,
 * through optional wrappers) and for record-to-record changes of a nested record field.
 * Everything else, container element changes included, is rejected with
 * {@link SchemaChangeException}.
 */
public final class TableChanges {
  private static final Logger log = LoggerFactory.getLogger(TableChanges.class);

  private final TableBuilder builder;

  public TableChanges() {
    this(new TableBuilder());
  }

  public TableChanges(TableBuilder builder) {
    this.builder = Objects.requireNonNull(builder, "builder");
  }

  public TableChange plan(ShapeDiff diff) {
    Objects.requireNonNull(diff, "diff");
    switch (diff.kind()) {
      case EQUAL -> throw new SchemaChangeException("Cannot alter table from an equal diff: no changes needed");
      case DIFFERENT -> throw new SchemaChangeException(
          "Cannot alter table from a different diff: shapes are incompatible (" + diff.from() + " -> " + diff.to() + ")");
      case SEQUENCE -> throw new SchemaChangeException(
          "Cannot alter table from a sequence diff: only record diffs are supported");
      case STRUCT -> { }
    }

    Shape to = diff.to();
    String table = TableBuilder.tableName(to);

    List<Column> added = new ArrayList<>();
    for (String name : diff.insertions()) {
      added.add(builder.column(field(to, name)));
    }

    List<Column> altered = new ArrayList<>();
    for (Map.Entry<String, ShapeDiff> e : diff.updates().entrySet()) {
      if (!isCompatible(e.getValue())) {
        throw new SchemaChangeException("Incompatible type change for field '" + e.getKey()
            + "'. Only conversions between numbers and strings are supported");
      }
      altered.add(builder.column(field(to, e.getKey())));
    }

    List<String> dropped = new ArrayList<>(diff.deletions());

    TableChange change = new TableChange(table, added, altered, dropped);
    if (change.isEmpty()) throw new SchemaChangeException("No column changes found for table '" + table + "'");

    if (log.isDebugEnabled()) {
      log.debug("tabula.alter table={} added={} altered={} dropped={}",
          table, added.size(), altered.size(), dropped.size());
    }
    return change;
  }

  static boolean isCompatible(ShapeDiff fieldDiff) {
    if (fieldDiff.kind() == ShapeDiff.Kind.EQUAL || fieldDiff.kind() == ShapeDiff.Kind.STRUCT) return true;
    Shape from = unwrapOptional(fieldDiff.from());
    Shape to = unwrapOptional(fieldDiff.to());
    if (ShapeDiff.sameShape(from, to)) return true;
    return isScalarConvertible(from) && isScalarConvertible(to);
  }

  private static boolean isScalarConvertible(Shape s) {
    return isNumeric(s) || isTextual(s);
  }

  private static boolean isNumeric(Shape s) {
    return s.kind() == ShapeKind.PRIMITIVE
        && (s.primitive() == PrimitiveType.INTEGER || s.primitive() == PrimitiveType.FLOAT);
  }

  private static boolean isTextual(Shape s) {
    if (s.kind() == ShapeKind.PRIMITIVE && s.primitive() == PrimitiveType.CHAR) return true;
    return ShapeInspector.isText(s);
  }

  private static Shape unwrapOptional(Shape s) {
    Shape cur = s;
    Shape inner;
    while ((inner = ShapeInspector.optionInner(cur)) != null) cur = inner;
    return cur;
  }

  private static Field field(Shape record, String name) {
    for (Field f : record.fields()) {
      if (f.name().equals(name)) return f;
    }
    throw new SchemaChangeException("Field '" + name + "' not found in '" + record.typeIdentifier() + "'");
  }
}
