package io.intellixity.tabula.schema;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Table}. */
public final class TableJsonSerializer extends JsonSerializer<Table> {
  @Override
  public void serialize(Table t, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (t == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("name", t.name());

    g.writeArrayFieldStart("columns");
    for (Column c : t.columns()) {
      g.writeStartObject();
      g.writeStringField("name", c.name());
      g.writeStringField("type", c.dataType().id());
      g.writeBooleanField("nullable", c.nullable());
      g.writeEndObject();
    }
    g.writeEndArray();

    if (t.primaryKey() != null) {
      g.writeStringField("primaryKey", t.primaryKey().name());
    }

    g.writeEndObject();
  }
}
