package io.intellixity.tabula.shape;

/**
 * Memory layout of a shape.\n
 *
 * {@code size < 0} means unsized (slices, trait objects).
 */
public record Layout(int size, boolean signed, boolean floating) {
  public static final Layout UNSIZED = new Layout(-1, false, false);

  public Layout {
    if (size < 0) size = -1;
  }

  public boolean sized() {
    return size >= 0;
  }

  public static Layout of(int size) {
    return new Layout(size, false, false);
  }

  public static Layout integer(int size, boolean signed) {
    return new Layout(size, signed, false);
  }

  public static Layout floating(int size) {
    return new Layout(size, true, true);
  }
}
