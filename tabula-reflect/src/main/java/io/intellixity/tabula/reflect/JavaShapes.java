package io.intellixity.tabula.reflect;

import io.intellixity.tabula.shape.*;
import io.intellixity.tabula.shape.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.*;
import java.math.BigInteger;
import java.util.*;

/**
 * Derives {@link Shape}s from Java records and classes via reflection.
 *
 * Records contribute their components in declaration order; other classes their non-static,
 * non-transient fields, inherited ones first. Field attributes come from {@link PrimaryKey} and {@link Attr}.
 * Generic types must be fully monomorphized: {@code Container<Long>} works through a field or
 * component type, a bare type variable does not.
 */
public final class JavaShapes {
  private static final Logger log = LoggerFactory.getLogger(JavaShapes.class);

  private JavaShapes() {}

  public static Shape of(Class<?> type) {
    Objects.requireNonNull(type, "type");
    Shape shape = new Walk().shape(type, Map.of(), type.getName());
    if (log.isDebugEnabled()) {
      log.debug("tabula.reflect class={} shape={} fields={}", type.getName(), shape, shape.fields().size());
    }
    return shape;
  }

  /** A type argument together with the scope its own type variables resolve in. */
  private record Bound(Type type, Map<TypeVariable<?>, Bound> scope) {}

  /** Per-call state: finished user types and the ones currently being walked. */
  private static final class Walk {
    private final Map<String, Shape> done = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    Shape shape(Type t, Map<TypeVariable<?>, Bound> scope, String where) {
      if (t instanceof Class<?> c) return classShape(c, List.of(), where);
      if (t instanceof ParameterizedType p) {
        List<Bound> args = new ArrayList<>();
        for (Type a : p.getActualTypeArguments()) args.add(bind(a, scope, where));
        return classShape((Class<?>) p.getRawType(), args, where);
      }
      if (t instanceof GenericArrayType g) return slice(shape(g.getGenericComponentType(), scope, where));
      if (t instanceof TypeVariable<?>) {
        Bound b = bind(t, scope, where);
        return shape(b.type(), b.scope(), where);
      }
      throw new IllegalArgumentException("Unsupported Java type " + t.getTypeName() + " at " + where);
    }

    private Shape shape(Bound b, String where) {
      return shape(b.type(), b.scope(), where);
    }

    private Shape classShape(Class<?> c, List<Bound> args, String where) {
      Shape known = builtin(c);
      if (known != null) return known;

      if (c.isArray()) return slice(shape(c.getComponentType(), Map.of(), where));
      if (c == Optional.class) return Shapes.option(shape(arg(c, args, 0, where), where));
      if (Map.class.isAssignableFrom(c)) {
        return Shapes.map(shape(arg(c, args, 0, where), where), shape(arg(c, args, 1, where), where));
      }
      if (Set.class.isAssignableFrom(c)) return Shapes.set(shape(arg(c, args, 0, where), where));
      if (Collection.class.isAssignableFrom(c)) return Shapes.list(shape(arg(c, args, 0, where), where));
      if (c.isEnum()) return enumShape(c);

      boolean jdk = c.getName().startsWith("java.") || c.getName().startsWith("javax.");
      if (jdk || c.isInterface() || Modifier.isAbstract(c.getModifiers())) {
        return Shapes.opaque(c.getSimpleName(), Set.of());
      }
      return recordShape(c, args, where);
    }

    private Shape recordShape(Class<?> c, List<Bound> args, String where) {
      TypeVariable<?>[] params = c.getTypeParameters();
      if (params.length != args.size()) {
        throw new IllegalArgumentException("Generic type " + c.getName() + " must be used with concrete type arguments at " + where);
      }
      Map<TypeVariable<?>, Bound> own = new HashMap<>();
      for (int i = 0; i < params.length; i++) own.put(params[i], args.get(i));

      String id = name(c, args, false);
      String key = name(c, args, true);
      Shape cached = done.get(key);
      if (cached != null) return cached;
      // back-reference to a type still being walked: field-less stub
      if (!inProgress.add(key)) return Shapes.record(id);

      List<Field> fields = new ArrayList<>();
      if (c.isRecord()) {
        for (RecordComponent rc : c.getRecordComponents()) {
          String at = c.getSimpleName() + "." + rc.getName();
          fields.add(new Field(rc.getName(), shape(rc.getGenericType(), own, at), attributes(rc)));
        }
      } else {
        instanceFields(c, own, fields);
      }

      inProgress.remove(key);
      Shape shape = Shapes.record(id, fields);
      done.put(key, shape);
      return shape;
    }

    /** Superclass fields first, each class resolved in its own generic scope. */
    private void instanceFields(Class<?> c, Map<TypeVariable<?>, Bound> scope, List<Field> out) {
      Class<?> sup = c.getSuperclass();
      if (sup != null && sup != Object.class) {
        Map<TypeVariable<?>, Bound> supScope = new HashMap<>();
        Type generic = c.getGenericSuperclass();
        if (generic instanceof ParameterizedType p) {
          TypeVariable<?>[] params = sup.getTypeParameters();
          Type[] actual = p.getActualTypeArguments();
          for (int i = 0; i < params.length; i++) {
            supScope.put(params[i], bind(actual[i], scope, c.getSimpleName() + " extends " + sup.getSimpleName()));
          }
        }
        instanceFields(sup, supScope, out);
      }
      for (java.lang.reflect.Field f : c.getDeclaredFields()) {
        int mod = f.getModifiers();
        if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) continue;
        String at = c.getSimpleName() + "." + f.getName();
        out.add(new Field(f.getName(), shape(f.getGenericType(), scope, at), attributes(f)));
      }
    }
  }

  private static Bound bind(Type t, Map<TypeVariable<?>, Bound> scope, String where) {
    if (t instanceof TypeVariable<?> v) {
      Bound b = scope.get(v);
      if (b == null) throw new IllegalArgumentException("Unresolved type variable " + v.getName() + " at " + where);
      return b;
    }
    if (t instanceof WildcardType) {
      throw new IllegalArgumentException("Wildcard type " + t.getTypeName() + " is not supported at " + where);
    }
    return new Bound(t, scope);
  }

  private static Bound arg(Class<?> c, List<Bound> args, int i, String where) {
    if (args.size() <= i) throw new IllegalArgumentException("Raw " + c.getSimpleName() + " needs type arguments at " + where);
    return args.get(i);
  }

  private static Shape builtin(Class<?> c) {
    if (c == boolean.class || c == Boolean.class) return Shapes.bool();
    if (c == byte.class || c == Byte.class) return Shapes.integer(c.getSimpleName(), 1, true);
    if (c == short.class || c == Short.class) return Shapes.integer(c.getSimpleName(), 2, true);
    if (c == int.class || c == Integer.class) return Shapes.integer(c.getSimpleName(), 4, true);
    if (c == long.class || c == Long.class) return Shapes.integer(c.getSimpleName(), 8, true);
    if (c == BigInteger.class) return Shapes.integer("BigInteger", 16, true);
    if (c == float.class || c == Float.class) return Shapes.floating(c.getSimpleName(), 4);
    if (c == double.class || c == Double.class) return Shapes.floating(c.getSimpleName(), 8);
    if (c == char.class || c == Character.class) return Shapes.character();
    if (c == String.class) return Shapes.string();
    if (c == CharSequence.class) return Shapes.strRef();
    if (c == OptionalInt.class) return Shapes.option(Shapes.integer("int", 4, true));
    if (c == OptionalLong.class) return Shapes.option(Shapes.integer("long", 8, true));
    if (c == OptionalDouble.class) return Shapes.option(Shapes.floating("double", 8));
    return null;
  }

  private static Shape enumShape(Class<?> c) {
    Object[] constants = c.getEnumConstants();
    String[] names = new String[constants.length];
    for (int i = 0; i < constants.length; i++) names[i] = ((Enum<?>) constants[i]).name();
    return Shapes.unitTagged(c.getSimpleName(), names);
  }

  /** Java arrays behave like slices: a growable-sequence def under the sequence kind. */
  private static Shape slice(Shape element) {
    return new Shape(element.typeIdentifier() + "[]", ShapeKind.SEQUENCE, Layout.UNSIZED, null,
        new ListDef(element), null, null, null, null);
  }

  private static String name(Class<?> c, List<Bound> args, boolean qualified) {
    String base = qualified ? c.getName() : c.getSimpleName();
    if (args.isEmpty()) return base;
    StringJoiner j = new StringJoiner(",", base + "<", ">");
    for (Bound a : args) j.add(name(a, qualified));
    return j.toString();
  }

  private static String name(Bound b, boolean qualified) {
    Type t = b.type();
    if (t instanceof Class<?> c) return qualified ? c.getTypeName() : c.getSimpleName();
    if (t instanceof ParameterizedType p) {
      List<Bound> args = new ArrayList<>();
      for (Type a : p.getActualTypeArguments()) args.add(bind(a, b.scope(), t.getTypeName()));
      return name((Class<?>) p.getRawType(), args, qualified);
    }
    if (t instanceof GenericArrayType g) return name(new Bound(g.getGenericComponentType(), b.scope()), qualified) + "[]";
    return t.getTypeName();
  }

  private static List<Attribute> attributes(AnnotatedElement el) {
    List<Attribute> out = new ArrayList<>();
    if (el.isAnnotationPresent(PrimaryKey.class)) out.add(Attribute.primaryKey());
    for (Attr a : el.getAnnotationsByType(Attr.class)) {
      out.add(new Attribute(a.ns().isEmpty() ? null : a.ns(), a.key(), a.value().isEmpty() ? null : a.value()));
    }
    return out;
  }
}
