package io.intellixity.tabula.schema;

import java.util.Locale;

public enum BuiltinType implements SqlType {
  BOOLEAN,
  SMALLINT,
  INTEGER,
  BIGINT,
  REAL,
  DOUBLE_PRECISION,
  TEXT,
  JSONB;

  @Override
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
