package io.intellixity.tabula.shape;

import java.util.Locale;

/**
 * Capabilities a shape advertises independently of its nominal identifier.
 * <p>
 * Lets the mapper ask "is this text?" instead of matching type names.
 */
public enum ShapeTrait {
  TEXT;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ShapeTrait fromId(String id) {
    return valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}
