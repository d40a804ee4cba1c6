package io.intellixity.tabula.convert;

/**
 * Raised when a shape cannot be converted into a table.
 * <p>
 * Always terminal: no partial table is produced. {@link #kind()} tells callers which rule failed.
 */
public final class ConversionException extends RuntimeException {
  public enum Kind {
    /** Top-level shape is not a composite record (tagged types included). */
    NOT_A_STRUCT,
    /** Two or more fields carry the primary-key attribute. */
    MULTIPLE_PRIMARY_KEYS,
    /** A field's shape matches no type mapping rule. */
    UNSUPPORTED_TYPE
  }

  private final Kind kind;

  public ConversionException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ConversionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  static ConversionException notAStruct(String detail) {
    return new ConversionException(Kind.NOT_A_STRUCT, "Expected struct, got: " + detail);
  }

  static ConversionException multiplePrimaryKeys(String detail) {
    return new ConversionException(Kind.MULTIPLE_PRIMARY_KEYS, "Multiple primary keys defined: " + detail);
  }

  static ConversionException unsupportedType(String detail) {
    return new ConversionException(Kind.UNSUPPORTED_TYPE, "Unsupported type: " + detail);
  }
}
