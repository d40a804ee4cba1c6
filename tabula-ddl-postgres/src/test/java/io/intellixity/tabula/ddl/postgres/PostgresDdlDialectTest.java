package io.intellixity.tabula.ddl.postgres;

import io.intellixity.tabula.convert.TableBuilder;
import io.intellixity.tabula.ddl.DdlDialects;
import io.intellixity.tabula.ddl.DdlOptions;
import io.intellixity.tabula.diff.ShapeDiff;
import io.intellixity.tabula.diff.TableChange;
import io.intellixity.tabula.diff.TableChanges;
import io.intellixity.tabula.schema.Table;
import io.intellixity.tabula.shape.Shape;
import org.junit.jupiter.api.Test;

import static io.intellixity.tabula.shape.Shapes.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDdlDialectTest {
  private final PostgresDdlDialect d = new PostgresDdlDialect();
  private final TableBuilder builder = new TableBuilder();

  @Test
  void rendersEveryColumnType() {
    Table t = builder.convert(record("Everything",
        primaryKey("id", u64()),
        field("flag", bool()),
        field("small", i16()),
        field("medium", u32()),
        field("ratio", f32()),
        field("score", f64()),
        field("initial", character()),
        field("name", string()),
        field("tags", list(string())),
        field("note", option(strRef()))));

    assertEquals("""
        CREATE TABLE "everything" (
          "id" bigint NOT NULL,
          "flag" boolean NOT NULL,
          "small" smallint NOT NULL,
          "medium" integer NOT NULL,
          "ratio" real NOT NULL,
          "score" double precision NOT NULL,
          "initial" char(1) NOT NULL,
          "name" text NOT NULL,
          "tags" jsonb NOT NULL,
          "note" text,
          PRIMARY KEY ("id")
        );""", d.createTable(t, DdlOptions.DEFAULT));
  }

  @Test
  void qualifiesAndGuardsTableName() {
    Table t = builder.convert(record("BlogPost", primaryKey("id", string())));

    String sql = d.createTable(t, new DdlOptions("blog", true));

    assertTrue(sql.startsWith("CREATE TABLE IF NOT EXISTS \"blog\".\"blogpost\" ("), sql);
    assertTrue(sql.contains("PRIMARY KEY (\"id\")"), sql);
  }

  @Test
  void escapesEmbeddedQuotes() {
    Table t = builder.convert(record("Odd", field("we\"ird", u8())));

    assertTrue(d.createTable(t, DdlOptions.DEFAULT).contains("\"we\"\"ird\" smallint NOT NULL"));
  }

  @Test
  void rendersAlterTableWithUsingCast() {
    Shape from = record("User", primaryKey("id", u64()), field("age", string()), field("legacy", bool()));
    Shape to = record("User", primaryKey("id", u64()), field("age", option(u32())), field("email", string()));
    TableChange change = new TableChanges().plan(ShapeDiff.between(from, to));

    assertEquals("""
        ALTER TABLE "user"
          ADD COLUMN "email" text NOT NULL,
          ALTER COLUMN "age" TYPE integer USING "age"::integer,
          ALTER COLUMN "age" DROP NOT NULL,
          DROP COLUMN "legacy";""", d.alterTable(change, DdlOptions.DEFAULT));
  }

  @Test
  void isDiscoverableById() {
    assertTrue(new DdlDialects().forId("postgres") instanceof PostgresDdlDialect);
  }
}
