package io.intellixity.tabula.convert;

import io.intellixity.tabula.schema.SqlType;
import io.intellixity.tabula.shape.Layout;
import io.intellixity.tabula.shape.Shape;
import io.intellixity.tabula.shape.ShapeKind;

import java.util.Objects;

/**
 * Maps a field shape to a {@link SqlType}.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>optional wrapper: {@code Nullable(map(inner))}</li>
 *   <li>primitives by kind and layout size (bool, integer, float, char, str)</li>
 *   <li>text capability: {@code TEXT}</li>
 *   <li>reference whose referent is text: {@code TEXT}; other references are unsupported</li>
 *   <li>list, set and map containers: {@code JSONB}</li>
 *   <li>nested record: {@code JSONB}</li>
 *   <li>tagged type: {@code INTEGER} (the stored discriminant)</li>
 * </ol>
 * Anything else, fixed-length arrays included, fails with
 * {@link ConversionException.Kind#UNSUPPORTED_TYPE}.
 * <p>
 * The optional check runs first because optional wrappers are tagged types themselves.
 */
public final class TypeMapper {
  public SqlType map(Shape shape) {
    Objects.requireNonNull(shape, "shape");

    Shape inner = ShapeInspector.optionInner(shape);
    if (inner != null) return SqlType.nullable(map(inner));

    if (shape.kind() == ShapeKind.PRIMITIVE) return mapPrimitive(shape);
    if (ShapeInspector.isText(shape)) return SqlType.TEXT;
    if (shape.kind() == ShapeKind.REFERENCE) return mapReference(shape);
    if (ShapeInspector.isContainer(shape)) return SqlType.JSONB;
    if (shape.kind() == ShapeKind.RECORD) return SqlType.JSONB;
    if (shape.kind() == ShapeKind.TAGGED) return SqlType.INTEGER;

    throw ConversionException.unsupportedType(describe(shape));
  }

  private static SqlType mapPrimitive(Shape shape) {
    return switch (shape.primitive()) {
      case BOOLEAN -> SqlType.BOOLEAN;
      case INTEGER -> integerType(shape);
      case FLOAT -> floatType(shape);
      case CHAR -> SqlType.fixedChar(1);
      case STR -> SqlType.TEXT;
      case NEVER -> throw ConversionException.unsupportedType(describe(shape));
    };
  }

  private static SqlType integerType(Shape shape) {
    Layout layout = shape.layout();
    if (!layout.sized()) throw ConversionException.unsupportedType("unsized integer " + shape.typeIdentifier());
    return switch (layout.size()) {
      case 1, 2 -> SqlType.SMALLINT;
      case 4 -> SqlType.INTEGER;
      // 16-byte integers share BIGINT with 8-byte ones
      case 8, 16 -> SqlType.BIGINT;
      default -> throw ConversionException.unsupportedType("integer with size " + layout.size());
    };
  }

  private static SqlType floatType(Shape shape) {
    Layout layout = shape.layout();
    if (!layout.sized()) throw ConversionException.unsupportedType("unsized float " + shape.typeIdentifier());
    if (layout.size() == 4) return SqlType.REAL;
    if (layout.size() == 8) return SqlType.DOUBLE_PRECISION;
    throw ConversionException.unsupportedType("float with size " + layout.size());
  }

  private static SqlType mapReference(Shape shape) {
    Shape referent = ShapeInspector.referent(shape);
    // Borrowed text is stored like owned text whatever the reference markers say.
    if (referent != null && ShapeInspector.isText(referent)) return SqlType.TEXT;
    throw ConversionException.unsupportedType("Pointer/reference type: " + shape.typeIdentifier());
  }

  static String describe(Shape shape) {
    return shape.kind().id() + " (type_identifier: " + shape.typeIdentifier() + ")";
  }
}
