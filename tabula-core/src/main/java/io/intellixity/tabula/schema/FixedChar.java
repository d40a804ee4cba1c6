package io.intellixity.tabula.schema;

/** Fixed-length character type; the converter only produces {@code length == 1}. */
public record FixedChar(int length) implements SqlType {
  public FixedChar {
    if (length <= 0) throw new IllegalArgumentException("char length must be > 0: " + length);
  }

  @Override
  public String id() {
    return "char(" + length + ")";
  }
}
