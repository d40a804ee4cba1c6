package io.intellixity.tabula.convert;

import io.intellixity.tabula.schema.Column;
import io.intellixity.tabula.schema.SqlType;
import io.intellixity.tabula.schema.Table;
import io.intellixity.tabula.shape.Field;
import io.intellixity.tabula.shape.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts a record {@link Shape} into a {@link Table}.\n
 *
 * Stateless and thread-safe; one linear pass over the fields per call.
 */
public final class TableBuilder {
  private static final Logger log = LoggerFactory.getLogger(TableBuilder.class);

  private final TypeMapper types;
  private final AttributeResolver attributes;

  public TableBuilder() {
    this(new TypeMapper(), new AttributeResolver());
  }

  public TableBuilder(TypeMapper types, AttributeResolver attributes) {
    this.types = Objects.requireNonNull(types, "types");
    this.attributes = Objects.requireNonNull(attributes, "attributes");
  }

  /**
   * Converts {@code shape} into a table.
   *
   * @throws ConversionException if the shape is not a record, a field type is unsupported,
   *     or more than one field is marked as primary key
   */
  public Table convert(Shape shape) {
    Objects.requireNonNull(shape, "shape");
    if (!ShapeInspector.isRecord(shape)) {
      throw ConversionException.notAStruct(TypeMapper.describe(shape));
    }

    String tableName = tableName(shape);
    List<Column> columns = new ArrayList<>();
    List<Column> pkColumns = new ArrayList<>();

    for (Field f : ShapeInspector.fields(shape)) {
      Column c = column(f);
      columns.add(c);
      if (attributes.isPrimaryKey(f)) pkColumns.add(c);
    }

    if (pkColumns.size() > 1) {
      List<String> names = pkColumns.stream().map(Column::name).toList();
      throw ConversionException.multiplePrimaryKeys(
          "Table '" + tableName + "' has " + names.size() + " primary keys: " + names);
    }

    Table table = new Table(tableName, columns, pkColumns.isEmpty() ? null : pkColumns.get(0));
    if (log.isDebugEnabled()) {
      log.debug("tabula.convert type={} table={} columns={} primaryKey={}",
          shape.typeIdentifier(), table.name(), columns.size(),
          table.primaryKey() == null ? "none" : table.primaryKey().name());
    }
    return table;
  }

  /** Column for a single field; the Nullable layer of the mapped type becomes the nullable flag. */
  public Column column(Field field) {
    SqlType mapped = types.map(field.shape());
    boolean nullable = ShapeInspector.isOptional(field.shape());
    return new Column(field.name(), SqlType.nonNull(mapped), nullable);
  }

  /**
   * Lowercased type identifier.\n
   *
   * Generic arguments are dropped: {@code Container<u64>} and {@code Container<String>} both become
   * {@code container}.
   */
  public static String tableName(Shape shape) {
    String id = shape.typeIdentifier();
    int lt = id.indexOf('<');
    if (lt >= 0) id = id.substring(0, lt);
    return id.trim().toLowerCase(Locale.ROOT);
  }
}
