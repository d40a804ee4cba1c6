package io.intellixity.tabula.shape.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.tabula.shape.Shape;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes shapes in their canonical JSON form. */
public final class ShapeJson {
  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ShapeJson() {}

  public static ObjectMapper mapper() {
    return JSON;
  }

  public static Shape read(String json) {
    try {
      Shape s = JSON.readValue(json, Shape.class);
      if (s == null) throw new IllegalArgumentException("Shape JSON is null");
      return s;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid shape JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Shape read(Path file) {
    try {
      return read(Files.readString(file));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read shape from " + file, e);
    }
  }

  public static String write(Object shapeOrTable) {
    try {
      return JSON.writeValueAsString(shapeOrTable);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-encode " + shapeOrTable, e);
    }
  }
}
