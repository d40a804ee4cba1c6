package io.intellixity.tabula.shape.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.tabula.shape.*;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link Shape}. */
public final class ShapeJsonSerializer extends JsonSerializer<Shape> {
  @Override
  public void serialize(Shape s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    writeShape(s, g, serializers);
  }

  private static void writeShape(Shape s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("type", s.typeIdentifier());
    g.writeStringField("kind", s.kind().id());
    if (s.primitive() != null) g.writeStringField("primitive", s.primitive().id());

    Layout l = s.layout();
    if (l.sized()) {
      g.writeObjectFieldStart("layout");
      g.writeNumberField("size", l.size());
      if (l.signed()) g.writeBooleanField("signed", true);
      if (l.floating()) g.writeBooleanField("float", true);
      g.writeEndObject();
    }

    if (!(s.def() instanceof UndefinedDef)) {
      g.writeFieldName("def");
      writeDef(s.def(), g, serializers);
    }

    if (!s.traits().isEmpty()) {
      g.writeArrayFieldStart("traits");
      for (ShapeTrait t : ShapeTrait.values()) {
        if (s.hasTrait(t)) g.writeString(t.id());
      }
      g.writeEndArray();
    }

    if (!s.fields().isEmpty()) {
      g.writeFieldName("fields");
      writeFields(s.fields(), g, serializers);
    }

    if (!s.variants().isEmpty()) {
      g.writeArrayFieldStart("variants");
      for (Variant v : s.variants()) {
        g.writeStartObject();
        g.writeStringField("name", v.name());
        if (!v.fields().isEmpty()) {
          g.writeFieldName("fields");
          writeFields(v.fields(), g, serializers);
        }
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (s.pointee() != null) {
      g.writeFieldName("pointee");
      writeShape(s.pointee(), g, serializers);
    }

    g.writeEndObject();
  }

  private static void writeDef(ShapeDef def, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeStringField("kind", def.id());
    if (def instanceof OptionDef o) {
      g.writeFieldName("inner");
      writeShape(o.inner(), g, serializers);
    } else if (def instanceof ListDef ld) {
      g.writeFieldName("element");
      writeShape(ld.element(), g, serializers);
    } else if (def instanceof SetDef sd) {
      g.writeFieldName("element");
      writeShape(sd.element(), g, serializers);
    } else if (def instanceof MapDef md) {
      g.writeFieldName("key");
      writeShape(md.key(), g, serializers);
      g.writeFieldName("value");
      writeShape(md.value(), g, serializers);
    } else if (def instanceof ArrayDef ad) {
      g.writeFieldName("element");
      writeShape(ad.element(), g, serializers);
      g.writeNumberField("length", ad.length());
    }
    g.writeEndObject();
  }

  private static void writeFields(List<Field> fields, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartArray();
    for (Field f : fields) {
      g.writeStartObject();
      g.writeStringField("name", f.name());
      g.writeFieldName("shape");
      writeShape(f.shape(), g, serializers);
      if (!f.attributes().isEmpty()) {
        g.writeArrayFieldStart("attributes");
        for (Attribute a : f.attributes()) {
          g.writeStartObject();
          if (a.namespace() != null) g.writeStringField("ns", a.namespace());
          g.writeStringField("key", a.key());
          if (a.value() != null) {
            g.writeFieldName("value");
            serializers.defaultSerializeValue(a.value(), g);
          }
          g.writeEndObject();
        }
        g.writeEndArray();
      }
      g.writeEndObject();
    }
    g.writeEndArray();
  }
}
