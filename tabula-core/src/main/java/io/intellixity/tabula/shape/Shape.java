package io.intellixity.tabula.shape;

import io.intellixity.tabula.shape.json.ShapeJsonDeserializer;
import io.intellixity.tabula.shape.json.ShapeJsonSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reflection-derived structural description of a data type.
 * <p>
 * Which components are meaningful depends on {@link #kind()}:
 * <ul>
 *   <li>{@link ShapeKind#RECORD}: {@link #fields()} in declaration order</li>
 *   <li>{@link ShapeKind#TAGGED}: {@link #variants()}</li>
 *   <li>{@link ShapeKind#REFERENCE}: {@link #pointee()}</li>
 *   <li>{@link ShapeKind#PRIMITIVE}: {@link #primitive()} and {@link #layout()}</li>
 * </ul>
 * Containers and optional wrappers are described by {@link #def()}.
 * <p>
 * Instances are usually built with {@link Shapes}.
 */
@JsonSerialize(using = ShapeJsonSerializer.class)
@JsonDeserialize(using = ShapeJsonDeserializer.class)
public record Shape(
    String typeIdentifier,
    ShapeKind kind,
    Layout layout,
    PrimitiveType primitive,
    ShapeDef def,
    List<Field> fields,
    List<Variant> variants,
    Shape pointee,
    Set<ShapeTrait> traits
) {
  public Shape {
    Objects.requireNonNull(typeIdentifier, "typeIdentifier");
    Objects.requireNonNull(kind, "kind");
    layout = layout == null ? Layout.UNSIZED : layout;
    def = def == null ? ShapeDef.UNDEFINED : def;
    fields = fields == null ? List.of() : List.copyOf(fields);
    variants = variants == null ? List.of() : List.copyOf(variants);
    traits = (traits == null || traits.isEmpty()) ? Set.of() : Set.copyOf(EnumSet.copyOf(traits));
    if (kind == ShapeKind.PRIMITIVE && primitive == null) {
      throw new IllegalArgumentException("Primitive shape requires a primitive type: " + typeIdentifier);
    }
  }

  public boolean hasTrait(ShapeTrait trait) {
    return traits.contains(trait);
  }

  @Override
  public String toString() {
    return kind.id() + "(" + typeIdentifier + ")";
  }
}
