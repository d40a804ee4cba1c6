package io.intellixity.tabula.convert;

import io.intellixity.tabula.shape.*;

import java.util.List;

/**
 * Read-only classification queries over {@link Shape}.\n
 *
 * Every method is total: unknown or absent information yields {@code false}, an empty list or null.
 */
public final class ShapeInspector {
  private ShapeInspector() {}

  public static ShapeKind kind(Shape shape) {
    return shape.kind();
  }

  public static boolean isRecord(Shape shape) {
    return shape.kind() == ShapeKind.RECORD;
  }

  /** Record fields in source order; empty for non-records. */
  public static List<Field> fields(Shape shape) {
    return isRecord(shape) ? shape.fields() : List.of();
  }

  /** Directly referenced shape of a reference, or null. */
  public static Shape pointee(Shape shape) {
    return shape.kind() == ShapeKind.REFERENCE ? shape.pointee() : null;
  }

  /** Follows reference chains ({@code &&T}) down to the first non-reference shape, or null. */
  public static Shape referent(Shape shape) {
    Shape cur = pointee(shape);
    while (cur != null && cur.kind() == ShapeKind.REFERENCE) {
      cur = cur.pointee();
    }
    return cur;
  }

  public static boolean isOptional(Shape shape) {
    return shape.def() instanceof OptionDef;
  }

  /** Wrapped shape of an optional wrapper, or null. */
  public static Shape optionInner(Shape shape) {
    return (shape.def() instanceof OptionDef o) ? o.inner() : null;
  }

  /** Owned or borrowed text: the {@code str} primitive or anything advertising {@link ShapeTrait#TEXT}. */
  public static boolean isText(Shape shape) {
    if (shape.kind() == ShapeKind.PRIMITIVE && shape.primitive() == PrimitiveType.STR) return true;
    return shape.hasTrait(ShapeTrait.TEXT);
  }

  /** Growable sequence, set or associative container. Fixed-length arrays are not containers. */
  public static boolean isContainer(Shape shape) {
    ShapeDef def = shape.def();
    return def instanceof ListDef || def instanceof SetDef || def instanceof MapDef;
  }
}
