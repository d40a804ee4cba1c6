package io.intellixity.tabula.ddl;

import io.intellixity.tabula.diff.TableChange;
import io.intellixity.tabula.schema.Column;
import io.intellixity.tabula.schema.Nullable;
import io.intellixity.tabula.schema.SqlType;
import io.intellixity.tabula.schema.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SQL-generic DDL dialect base.\n
 *
 * Provides common rendering for:\n
 * - CREATE TABLE with column list, NOT NULL and a PRIMARY KEY constraint\n
 * - ALTER TABLE with ADD COLUMN / ALTER COLUMN / DROP COLUMN actions in one statement\n
 *
 * DB-specific dialects override quoting and type-name hooks.\n
 */
public abstract class AbstractSqlDdlDialect implements DdlDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractSqlDdlDialect.class);

  @Override
  public final String createTable(Table table, DdlOptions options) {
    Objects.requireNonNull(table, "table");
    DdlOptions opts = options == null ? DdlOptions.DEFAULT : options;

    List<String> items = new ArrayList<>();
    for (Column c : table.columns()) items.add(renderColumn(c));
    if (table.primaryKey() != null) {
      items.add("PRIMARY KEY (" + quoteIdent(table.primaryKey().name()) + ")");
    }

    StringBuilder sql = new StringBuilder("CREATE TABLE ");
    if (opts.ifNotExists()) sql.append("IF NOT EXISTS ");
    sql.append(qualifiedName(table.name(), opts));
    if (items.isEmpty()) {
      sql.append(" ()");
    } else {
      sql.append(" (\n  ").append(String.join(",\n  ", items)).append("\n)");
    }
    sql.append(';');

    if (log.isDebugEnabled()) {
      log.debug("tabula.ddl dialect={} op=create table={} columns={}", id(), table.name(), table.columns().size());
    }
    return sql.toString();
  }

  @Override
  public final String alterTable(TableChange change, DdlOptions options) {
    Objects.requireNonNull(change, "change");
    if (change.isEmpty()) throw new IllegalArgumentException("TableChange has no actions: " + change.table());
    DdlOptions opts = options == null ? DdlOptions.DEFAULT : options;

    List<String> actions = new ArrayList<>();
    for (Column c : change.added()) {
      actions.add("ADD COLUMN " + renderColumn(c));
    }
    for (Column c : change.altered()) {
      String col = quoteIdent(c.name());
      String type = typeName(c.dataType());
      actions.add("ALTER COLUMN " + col + " TYPE " + type + usingCast(col, type));
      actions.add("ALTER COLUMN " + col + (c.nullable() ? " DROP NOT NULL" : " SET NOT NULL"));
    }
    for (String name : change.dropped()) {
      actions.add("DROP COLUMN " + quoteIdent(name));
    }

    String sql = "ALTER TABLE " + qualifiedName(change.table(), opts) + "\n  " + String.join(",\n  ", actions) + ";";
    if (log.isDebugEnabled()) {
      log.debug("tabula.ddl dialect={} op=alter table={} actions={}", id(), change.table(), actions.size());
    }
    return sql;
  }

  protected String renderColumn(Column c) {
    String sql = quoteIdent(c.name()) + " " + typeName(c.dataType());
    return c.nullable() ? sql : sql + " NOT NULL";
  }

  protected String qualifiedName(String table, DdlOptions opts) {
    if (opts.schema() == null) return quoteIdent(table);
    return quoteIdent(opts.schema()) + "." + quoteIdent(table);
  }

  /** Type name for a non-nullable {@link SqlType}; a {@link Nullable} layer is stripped first. */
  protected final String typeName(SqlType type) {
    SqlType t = SqlType.nonNull(type);
    String name = renderType(t);
    if (name == null) throw new IllegalArgumentException("Dialect " + id() + " cannot render type " + t.id());
    return name;
  }

  /** Suffix appended to {@code ALTER COLUMN ... TYPE}; empty by default. */
  protected String usingCast(String quotedColumn, String typeName) {
    return "";
  }

  protected abstract String renderType(SqlType type);

  protected abstract String quoteIdent(String ident);
}
