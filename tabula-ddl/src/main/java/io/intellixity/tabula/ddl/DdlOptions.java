package io.intellixity.tabula.ddl;

/**
 * Rendering options shared by all dialects.\n
 *
 * {@code schema} qualifies table names when non-blank; {@code ifNotExists} guards CREATE TABLE.
 */
public record DdlOptions(String schema, boolean ifNotExists) {
  public static final DdlOptions DEFAULT = new DdlOptions(null, false);

  public DdlOptions {
    schema = (schema == null || schema.isBlank()) ? null : schema.trim();
  }

  public DdlOptions withSchema(String s) {
    return new DdlOptions(s, ifNotExists);
  }
}
