package io.intellixity.tabula.schema;

/**
 * Column data type produced by the conversion.\n
 *
 * Closed set: the {@link BuiltinType} constants, {@link FixedChar} and {@link Nullable}.
 */
public sealed interface SqlType permits BuiltinType, FixedChar, Nullable {
  SqlType BOOLEAN = BuiltinType.BOOLEAN;
  SqlType SMALLINT = BuiltinType.SMALLINT;
  SqlType INTEGER = BuiltinType.INTEGER;
  SqlType BIGINT = BuiltinType.BIGINT;
  SqlType REAL = BuiltinType.REAL;
  SqlType DOUBLE_PRECISION = BuiltinType.DOUBLE_PRECISION;
  SqlType TEXT = BuiltinType.TEXT;
  SqlType JSONB = BuiltinType.JSONB;

  /** Canonical id, e.g. {@code bigint}, {@code char(1)}, {@code nullable(text)}. */
  String id();

  static SqlType fixedChar(int length) {
    return new FixedChar(length);
  }

  /** Wraps {@code t} once; an already nullable type is returned as is. */
  static SqlType nullable(SqlType t) {
    if (t instanceof Nullable) return t;
    return new Nullable(t);
  }

  /** Strips a {@link Nullable} layer if present. */
  static SqlType nonNull(SqlType t) {
    return (t instanceof Nullable n) ? n.inner() : t;
  }
}
