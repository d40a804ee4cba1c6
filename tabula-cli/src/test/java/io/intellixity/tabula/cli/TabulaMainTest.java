package io.intellixity.tabula.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class TabulaMainTest {
  private static final String USER = """
      {
        "type": "User",
        "kind": "record",
        "fields": [
          {
            "name": "id",
            "shape": { "type": "u64", "kind": "primitive", "primitive": "integer", "layout": { "size": 8 } },
            "attributes": [ { "ns": "psql", "key": "primary_key" } ]
          },
          { "name": "name", "shape": { "type": "String", "kind": "opaque", "traits": ["text"] } }
        ]
      }
      """;

  private static final String USER_V2 = """
      {
        "type": "User",
        "kind": "record",
        "fields": [
          {
            "name": "id",
            "shape": { "type": "u64", "kind": "primitive", "primitive": "integer", "layout": { "size": 8 } },
            "attributes": [ { "ns": "psql", "key": "primary_key" } ]
          },
          {
            "name": "email",
            "shape": {
              "type": "Option",
              "kind": "tagged",
              "def": { "kind": "option", "inner": { "type": "String", "kind": "opaque", "traits": ["text"] } }
            }
          }
        ]
      }
      """;

  @TempDir
  Path dir;

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

  private int run(String... args) {
    return TabulaMain.run(args,
        new PrintStream(outBytes, true, StandardCharsets.UTF_8),
        new PrintStream(errBytes, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return outBytes.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  private Path write(String name, String json) throws Exception {
    Path p = dir.resolve(name);
    Files.writeString(p, json);
    return p;
  }

  @Test
  void printsCreateTable() throws Exception {
    Path user = write("user.json", USER);

    assertEquals(0, run("--schema", "app", "--if-not-exists", user.toString()));
    assertTrue(out().startsWith("CREATE TABLE IF NOT EXISTS \"app\".\"user\" ("), out());
    assertTrue(out().contains("\"id\" bigint NOT NULL"), out());
    assertTrue(out().contains("PRIMARY KEY (\"id\")"), out());
  }

  @Test
  void printsTableJson() throws Exception {
    Path user = write("user.json", USER);

    assertEquals(0, run("--json", user.toString()));
    assertTrue(out().contains("\"primaryKey\" : \"id\""), out());
    assertTrue(out().contains("\"type\" : \"text\""), out());
  }

  @Test
  void printsAlterTableForDiff() throws Exception {
    Path from = write("v1.json", USER);
    Path to = write("v2.json", USER_V2);

    assertEquals(0, run("diff", from.toString(), to.toString()));
    assertTrue(out().contains("ADD COLUMN \"email\" text"), out());
    assertTrue(out().contains("DROP COLUMN \"name\""), out());
  }

  @Test
  void conversionErrorExitsWithOne() throws Exception {
    Path status = write("status.json", """
        { "type": "Status", "kind": "tagged", "variants": [ { "name": "Active" } ] }
        """);

    assertEquals(1, run(status.toString()));
    assertTrue(err().contains("Expected struct, got: tagged"), err());
  }

  @Test
  void missingFileExitsWithOne() {
    assertEquals(1, run(dir.resolve("nope.json").toString()));
    assertTrue(err().startsWith("error: "), err());
  }

  @Test
  void usageErrorsExitWithTwo() throws Exception {
    Path user = write("user.json", USER);

    assertEquals(2, run());
    assertEquals(2, run("--bogus", user.toString()));
    assertEquals(2, run("--schema"));
    assertEquals(2, run("diff", user.toString()));
    assertEquals(2, run("--dialect", "oracle", user.toString()));
    assertTrue(err().contains("Unknown DDL dialect 'oracle'"), err());
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(0, run("--help"));
    assertTrue(out().startsWith("Usage: TabulaMain"));
  }
}
