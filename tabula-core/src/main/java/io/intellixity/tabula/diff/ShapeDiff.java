package io.intellixity.tabula.diff;

import io.intellixity.tabula.shape.*;

import java.util.*;

/**
 * Structural difference between two shapes.\n
 *
 * Compares identifiers, kinds, primitives, layouts, defs, traits and (recursively) fields; field
 * attributes are not part of the comparison. For two records the result is {@link Kind#STRUCT}
 * with per-field changes; name sets keep source order (deletions/updates/unchanged in {@code from}
 * order, insertions in {@code to} order).
 */
public record ShapeDiff(
    Kind kind,
    Shape from,
    Shape to,
    Set<String> insertions,
    Set<String> deletions,
    Map<String, ShapeDiff> updates,
    Set<String> unchanged
) {
  public enum Kind {
    /** Structurally equal. */
    EQUAL,
    /** Incompatible shapes (different kinds, tagged types, primitives, ...). */
    DIFFERENT,
    /** Both records; see field sets. */
    STRUCT,
    /** Both built-in sequences. */
    SEQUENCE
  }

  public ShapeDiff {
    Objects.requireNonNull(kind, "kind");
    insertions = insertions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(insertions));
    deletions = deletions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(deletions));
    updates = updates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(updates));
    unchanged = unchanged == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(unchanged));
  }

  public boolean isEqual() {
    return kind == Kind.EQUAL;
  }

  public static ShapeDiff between(Shape from, Shape to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (sameShape(from, to)) return new ShapeDiff(Kind.EQUAL, from, to, null, null, null, null);

    if (from.kind() == ShapeKind.RECORD && to.kind() == ShapeKind.RECORD) {
      return structDiff(from, to);
    }
    if (from.kind() == ShapeKind.SEQUENCE && to.kind() == ShapeKind.SEQUENCE) {
      return new ShapeDiff(Kind.SEQUENCE, from, to, null, null, null, null);
    }
    return new ShapeDiff(Kind.DIFFERENT, from, to, null, null, null, null);
  }

  private static ShapeDiff structDiff(Shape from, Shape to) {
    Map<String, Field> toFields = new LinkedHashMap<>();
    for (Field f : to.fields()) toFields.put(f.name(), f);

    Set<String> deletions = new LinkedHashSet<>();
    Map<String, ShapeDiff> updates = new LinkedHashMap<>();
    Set<String> unchanged = new LinkedHashSet<>();
    Set<String> fromNames = new HashSet<>();

    for (Field ff : from.fields()) {
      fromNames.add(ff.name());
      Field tf = toFields.get(ff.name());
      if (tf == null) {
        deletions.add(ff.name());
        continue;
      }
      ShapeDiff fd = between(ff.shape(), tf.shape());
      if (fd.isEqual()) unchanged.add(ff.name());
      else updates.put(ff.name(), fd);
    }

    Set<String> insertions = new LinkedHashSet<>();
    for (Field tf : to.fields()) {
      if (!fromNames.contains(tf.name())) insertions.add(tf.name());
    }
    return new ShapeDiff(Kind.STRUCT, from, to, insertions, deletions, updates, unchanged);
  }

  static boolean sameShape(Shape a, Shape b) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    if (!a.typeIdentifier().equals(b.typeIdentifier())) return false;
    if (a.kind() != b.kind() || a.primitive() != b.primitive()) return false;
    if (!a.layout().equals(b.layout()) || !a.traits().equals(b.traits())) return false;
    if (!sameDef(a.def(), b.def())) return false;
    if (!sameFields(a.fields(), b.fields())) return false;
    if (a.variants().size() != b.variants().size()) return false;
    for (int i = 0; i < a.variants().size(); i++) {
      Variant av = a.variants().get(i);
      Variant bv = b.variants().get(i);
      if (!av.name().equals(bv.name()) || !sameFields(av.fields(), bv.fields())) return false;
    }
    return (a.pointee() == null && b.pointee() == null) || sameShape(a.pointee(), b.pointee());
  }

  private static boolean sameFields(List<Field> a, List<Field> b) {
    if (a.size() != b.size()) return false;
    for (int i = 0; i < a.size(); i++) {
      if (!a.get(i).name().equals(b.get(i).name())) return false;
      if (!sameShape(a.get(i).shape(), b.get(i).shape())) return false;
    }
    return true;
  }

  private static boolean sameDef(ShapeDef a, ShapeDef b) {
    if (a instanceof OptionDef x && b instanceof OptionDef y) return sameShape(x.inner(), y.inner());
    if (a instanceof ListDef x && b instanceof ListDef y) return sameShape(x.element(), y.element());
    if (a instanceof SetDef x && b instanceof SetDef y) return sameShape(x.element(), y.element());
    if (a instanceof MapDef x && b instanceof MapDef y) return sameShape(x.key(), y.key()) && sameShape(x.value(), y.value());
    if (a instanceof ArrayDef x && b instanceof ArrayDef y) return x.length() == y.length() && sameShape(x.element(), y.element());
    return a.getClass() == b.getClass();
  }
}
