package io.intellixity.tabula.ddl.postgres;

import io.intellixity.tabula.ddl.AbstractSqlDdlDialect;
import io.intellixity.tabula.schema.BuiltinType;
import io.intellixity.tabula.schema.FixedChar;
import io.intellixity.tabula.schema.SqlType;

/**
 * Postgres DDL dialect.
 *
 * Keeps only Postgres-specific quoting and type names, plus the USING cast that text/number
 * conversions need.\n
 * Generic DDL rendering lives in {@link AbstractSqlDdlDialect}.
 */
public final class PostgresDdlDialect extends AbstractSqlDdlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String renderType(SqlType type) {
    if (type instanceof FixedChar fc) return "char(" + fc.length() + ")";
    BuiltinType b = (BuiltinType) type;
    return switch (b) {
      case BOOLEAN -> "boolean";
      case SMALLINT -> "smallint";
      case INTEGER -> "integer";
      case BIGINT -> "bigint";
      case REAL -> "real";
      case DOUBLE_PRECISION -> "double precision";
      case TEXT -> "text";
      case JSONB -> "jsonb";
    };
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String usingCast(String quotedColumn, String typeName) {
    return " USING " + quotedColumn + "::" + typeName;
  }
}
