package io.intellixity.tabula.shape;

/**
 * Semantic definition of a shape, independent of its structural {@link ShapeKind}.\n
 *
 * An owned list and a borrowed slice have different kinds but may share a def.
 */
public sealed interface ShapeDef
    permits UndefinedDef, ScalarDef, OptionDef, ListDef, SetDef, MapDef, ArrayDef {

  ShapeDef UNDEFINED = new UndefinedDef();
  ShapeDef SCALAR = new ScalarDef();

  /** Short id used by the JSON form ("option", "list", ...). */
  String id();
}
