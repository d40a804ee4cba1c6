package io.intellixity.tabula.shape.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.tabula.shape.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical JSON deserializer for {@link Shape}.\n
 *
 * Malformed documents raise {@link IllegalArgumentException} naming the offending path.
 */
public final class ShapeJsonDeserializer extends JsonDeserializer<Shape> {
  @Override
  public Shape deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseShape(root, codec, "$");
  }

  private static Shape parseShape(JsonNode n, ObjectCodec codec, String path) throws IOException {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("Shape JSON must be an object at " + path);

    String type = textOrNull(n.get("type"));
    if (type == null) throw new IllegalArgumentException("Missing 'type' at " + path);
    String kindId = textOrNull(n.get("kind"));
    if (kindId == null) throw new IllegalArgumentException("Missing 'kind' at " + path);
    ShapeKind kind = ShapeKind.fromId(kindId);

    PrimitiveType primitive = parsePrimitive(textOrNull(n.get("primitive")), path);

    Layout layout = Layout.UNSIZED;
    JsonNode l = n.get("layout");
    if (l != null && l.isObject()) {
      layout = new Layout(intOrDefault(l.get("size"), -1), boolOrFalse(l.get("signed")), boolOrFalse(l.get("float")));
    }

    ShapeDef def = ShapeDef.UNDEFINED;
    JsonNode d = n.get("def");
    if (d != null && !d.isNull()) def = parseDef(d, codec, path + ".def");

    Set<ShapeTrait> traits = EnumSet.noneOf(ShapeTrait.class);
    JsonNode t = n.get("traits");
    if (t != null && t.isArray()) {
      for (JsonNode x : t) {
        if (!x.isTextual()) throw new IllegalArgumentException("Trait must be a string at " + path + ".traits");
        try {
          traits.add(ShapeTrait.fromId(x.asText()));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown trait '" + x.asText() + "' at " + path, e);
        }
      }
    }

    List<Field> fields = parseFields(n.get("fields"), codec, path + ".fields");

    List<Variant> variants = new ArrayList<>();
    JsonNode vs = n.get("variants");
    if (vs != null && vs.isArray()) {
      int i = 0;
      for (JsonNode v : vs) {
        String vp = path + ".variants[" + i++ + "]";
        String name = textOrNull(v.get("name"));
        if (name == null) throw new IllegalArgumentException("Missing variant 'name' at " + vp);
        variants.add(new Variant(name, parseFields(v.get("fields"), codec, vp + ".fields")));
      }
    }

    Shape pointee = null;
    JsonNode pt = n.get("pointee");
    if (pt != null && !pt.isNull()) pointee = parseShape(pt, codec, path + ".pointee");

    if (kind == ShapeKind.PRIMITIVE && primitive == null) {
      throw new IllegalArgumentException("Primitive shape '" + type + "' requires 'primitive' at " + path);
    }
    return new Shape(type, kind, layout, primitive, def, fields, variants, pointee, traits);
  }

  private static ShapeDef parseDef(JsonNode d, ObjectCodec codec, String path) throws IOException {
    // "def": "scalar" is shorthand for {"kind": "scalar"}
    String kind = d.isTextual() ? d.asText() : (d.isObject() ? textOrNull(d.get("kind")) : null);
    if (kind == null) throw new IllegalArgumentException("Missing def 'kind' at " + path);
    return switch (kind) {
      case "undefined" -> ShapeDef.UNDEFINED;
      case "scalar" -> ShapeDef.SCALAR;
      case "option" -> new OptionDef(parseShape(d.get("inner"), codec, path + ".inner"));
      case "list" -> new ListDef(parseShape(d.get("element"), codec, path + ".element"));
      case "set" -> new SetDef(parseShape(d.get("element"), codec, path + ".element"));
      case "map" -> new MapDef(
          parseShape(d.get("key"), codec, path + ".key"),
          parseShape(d.get("value"), codec, path + ".value"));
      case "array" -> new ArrayDef(
          parseShape(d.get("element"), codec, path + ".element"),
          intOrDefault(d.get("length"), 0));
      default -> throw new IllegalArgumentException("Unknown def kind '" + kind + "' at " + path);
    };
  }

  private static List<Field> parseFields(JsonNode arr, ObjectCodec codec, String path) throws IOException {
    List<Field> out = new ArrayList<>();
    if (arr == null || !arr.isArray()) return out;
    int i = 0;
    for (JsonNode f : arr) {
      String fp = path + "[" + i++ + "]";
      String name = textOrNull(f.get("name"));
      if (name == null) throw new IllegalArgumentException("Missing field 'name' at " + fp);
      Shape shape = parseShape(f.get("shape"), codec, fp + ".shape");
      out.add(new Field(name, shape, parseAttributes(f.get("attributes"), codec, fp)));
    }
    return out;
  }

  private static List<Attribute> parseAttributes(JsonNode arr, ObjectCodec codec, String path) throws IOException {
    List<Attribute> out = new ArrayList<>();
    if (arr == null || !arr.isArray()) return out;
    for (JsonNode a : arr) {
      String key = textOrNull(a.get("key"));
      if (key == null) throw new IllegalArgumentException("Missing attribute 'key' at " + path);
      JsonNode v = a.get("value");
      Object value = (v == null || v.isNull()) ? null : codec.treeToValue(v, Object.class);
      out.add(new Attribute(textOrNull(a.get("ns")), key, value));
    }
    return out;
  }

  private static PrimitiveType parsePrimitive(String id, String path) {
    if (id == null) return null;
    try {
      return PrimitiveType.fromId(id);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown primitive '" + id + "' at " + path, e);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    return (n == null || !n.canConvertToInt()) ? def : n.asInt();
  }

  private static boolean boolOrFalse(JsonNode n) {
    return n != null && n.asBoolean(false);
  }
}
