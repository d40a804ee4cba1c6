package io.intellixity.tabula.ddl;

import io.intellixity.tabula.diff.TableChange;
import io.intellixity.tabula.schema.Table;

/** Backend-specific SPI: renders converted tables and table changes as DDL statements. */
public interface DdlDialect {
  String id();

  String createTable(Table table, DdlOptions options);

  String alterTable(TableChange change, DdlOptions options);
}
