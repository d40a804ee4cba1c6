package io.intellixity.tabula.shape;

import java.util.Locale;

/** Structural kind of a {@link Shape}. */
public enum ShapeKind {
  /** Composite record with named fields. */
  RECORD,
  /** Tagged (discriminated) type; optional wrappers are tagged too. */
  TAGGED,
  /** Reference or pointer to another shape. */
  REFERENCE,
  PRIMITIVE,
  /** Library-defined type whose layout is hidden (owned text, containers). */
  OPAQUE,
  /** Built-in sequence such as a fixed-length array or slice. */
  SEQUENCE;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ShapeKind fromId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Shape kind is blank");
    for (ShapeKind k : values()) {
      if (k.id().equals(id.trim().toLowerCase(Locale.ROOT))) return k;
    }
    throw new IllegalArgumentException("Unknown shape kind: " + id);
  }
}
