package io.intellixity.tabula.shape;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Factory helpers for building {@link Shape} trees.\n
 *
 * Type identifiers follow the conventions of the reflection systems shapes usually come from
 * ({@code u64}, {@code String}, {@code Vec}, {@code Option}, ...). Nothing in the conversion
 * pipeline inspects identifiers; classification goes through structure and traits only.
 */
public final class Shapes {
  private Shapes() {}

  // ---- primitives ----

  public static Shape bool() {
    return new Shape("bool", ShapeKind.PRIMITIVE, Layout.of(1), PrimitiveType.BOOLEAN, ShapeDef.SCALAR,
        null, null, null, null);
  }

  public static Shape integer(String typeIdentifier, int size, boolean signed) {
    return new Shape(typeIdentifier, ShapeKind.PRIMITIVE, Layout.integer(size, signed), PrimitiveType.INTEGER,
        ShapeDef.SCALAR, null, null, null, null);
  }

  public static Shape u8() { return integer("u8", 1, false); }
  public static Shape u16() { return integer("u16", 2, false); }
  public static Shape u32() { return integer("u32", 4, false); }
  public static Shape u64() { return integer("u64", 8, false); }
  public static Shape u128() { return integer("u128", 16, false); }
  public static Shape i8() { return integer("i8", 1, true); }
  public static Shape i16() { return integer("i16", 2, true); }
  public static Shape i32() { return integer("i32", 4, true); }
  public static Shape i64() { return integer("i64", 8, true); }
  public static Shape i128() { return integer("i128", 16, true); }

  public static Shape floating(String typeIdentifier, int size) {
    return new Shape(typeIdentifier, ShapeKind.PRIMITIVE, Layout.floating(size), PrimitiveType.FLOAT,
        ShapeDef.SCALAR, null, null, null, null);
  }

  public static Shape f32() { return floating("f32", 4); }
  public static Shape f64() { return floating("f64", 8); }

  public static Shape character() {
    return new Shape("char", ShapeKind.PRIMITIVE, Layout.of(4), PrimitiveType.CHAR, ShapeDef.SCALAR,
        null, null, null, null);
  }

  /** Borrowed text slice ({@code str}); unsized. */
  public static Shape str() {
    return new Shape("str", ShapeKind.PRIMITIVE, Layout.UNSIZED, PrimitiveType.STR, ShapeDef.SCALAR,
        null, null, null, null);
  }

  public static Shape never() {
    return new Shape("!", ShapeKind.PRIMITIVE, Layout.of(0), PrimitiveType.NEVER, ShapeDef.UNDEFINED,
        null, null, null, null);
  }

  // ---- text ----

  /** Owned text container ({@code String}). */
  public static Shape string() {
    return text("String");
  }

  /** Opaque owned text type under an arbitrary identifier (e.g. {@code Cow<str>}). */
  public static Shape text(String typeIdentifier) {
    return new Shape(typeIdentifier, ShapeKind.OPAQUE, Layout.of(24), null, ShapeDef.SCALAR,
        null, null, null, EnumSet.of(ShapeTrait.TEXT));
  }

  // ---- references ----

  public static Shape ref(Shape pointee) {
    return new Shape("&" + pointee.typeIdentifier(), ShapeKind.REFERENCE, Layout.of(8), null, ShapeDef.SCALAR,
        null, null, pointee, null);
  }

  /** {@code &str}. */
  public static Shape strRef() {
    return ref(str());
  }

  // ---- wrappers and containers ----

  public static Shape option(Shape inner) {
    return new Shape("Option", ShapeKind.TAGGED, Layout.UNSIZED, null, new OptionDef(inner),
        null, List.of(new Variant("None", List.of()), new Variant("Some", List.of(new Field("0", inner)))),
        null, null);
  }

  public static Shape list(Shape element) {
    return new Shape("Vec", ShapeKind.OPAQUE, Layout.of(24), null, new ListDef(element),
        null, null, null, null);
  }

  public static Shape set(Shape element) {
    return new Shape("HashSet", ShapeKind.OPAQUE, Layout.of(48), null, new SetDef(element),
        null, null, null, null);
  }

  public static Shape map(Shape key, Shape value) {
    return new Shape("HashMap", ShapeKind.OPAQUE, Layout.of(48), null, new MapDef(key, value),
        null, null, null, null);
  }

  public static Shape array(Shape element, int length) {
    int size = element.layout().sized() ? element.layout().size() * length : -1;
    return new Shape("[" + element.typeIdentifier() + "; " + length + "]", ShapeKind.SEQUENCE,
        size < 0 ? Layout.UNSIZED : Layout.of(size), null, new ArrayDef(element, length),
        null, null, null, null);
  }

  // ---- user types ----

  public static Shape record(String typeIdentifier, Field... fields) {
    return record(typeIdentifier, Arrays.asList(fields));
  }

  public static Shape record(String typeIdentifier, List<Field> fields) {
    return new Shape(typeIdentifier, ShapeKind.RECORD, Layout.UNSIZED, null, ShapeDef.UNDEFINED,
        fields, null, null, null);
  }

  public static Shape tagged(String typeIdentifier, Variant... variants) {
    return new Shape(typeIdentifier, ShapeKind.TAGGED, Layout.UNSIZED, null, ShapeDef.UNDEFINED,
        null, Arrays.asList(variants), null, null);
  }

  /** Tagged type whose variants carry no data. */
  public static Shape unitTagged(String typeIdentifier, String... unitVariants) {
    Variant[] vs = new Variant[unitVariants.length];
    for (int i = 0; i < unitVariants.length; i++) vs[i] = new Variant(unitVariants[i], List.of());
    return tagged(typeIdentifier, vs);
  }

  public static Shape opaque(String typeIdentifier, Set<ShapeTrait> traits) {
    return new Shape(typeIdentifier, ShapeKind.OPAQUE, Layout.UNSIZED, null, ShapeDef.SCALAR,
        null, null, null, traits);
  }

  // ---- fields ----

  public static Field field(String name, Shape shape, Attribute... attributes) {
    return new Field(name, shape, Arrays.asList(attributes));
  }

  /** Field carrying the primary-key attribute. */
  public static Field primaryKey(String name, Shape shape) {
    return new Field(name, shape, List.of(Attribute.primaryKey()));
  }

  public static Variant variant(String name, Field... fields) {
    return new Variant(name, Arrays.asList(fields));
  }
}
