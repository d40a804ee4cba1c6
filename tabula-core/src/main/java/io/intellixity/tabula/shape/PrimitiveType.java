package io.intellixity.tabula.shape;

import java.util.Locale;

public enum PrimitiveType {
  BOOLEAN,
  INTEGER,
  FLOAT,
  CHAR,
  /** Borrowed text slice. */
  STR,
  NEVER;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PrimitiveType fromId(String id) {
    if (id == null || id.isBlank()) return null;
    return valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}
