package io.intellixity.tabula.diff;

/** Raised when a shape diff cannot be expressed as a table alteration. */
public final class SchemaChangeException extends RuntimeException {
  public SchemaChangeException(String message) {
    super(message);
  }

  public SchemaChangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
