package io.intellixity.tabula.ddl;

import io.intellixity.tabula.diff.TableChange;
import io.intellixity.tabula.schema.Column;
import io.intellixity.tabula.schema.SqlType;
import io.intellixity.tabula.schema.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDdlDialectTest {
  private final PlainDdlDialect d = new PlainDdlDialect();

  @Test
  void rendersCreateTableWithPrimaryKeyConstraint() {
    Column id = new Column("id", SqlType.BIGINT, false);
    Table t = new Table("user", List.of(
        id,
        new Column("nick", SqlType.TEXT, true),
        new Column("score", SqlType.DOUBLE_PRECISION, false)), id);

    assertEquals("""
        CREATE TABLE user (
          id BIGINT NOT NULL,
          nick TEXT,
          score DOUBLE PRECISION NOT NULL,
          PRIMARY KEY (id)
        );""", d.createTable(t, DdlOptions.DEFAULT));
  }

  @Test
  void appliesSchemaAndIfNotExists() {
    Table t = new Table("flag", List.of(new Column("c", SqlType.fixedChar(1), false)), null);

    String sql = d.createTable(t, new DdlOptions("app", true));

    assertTrue(sql.startsWith("CREATE TABLE IF NOT EXISTS app.flag ("), sql);
    assertTrue(sql.contains("c CHAR(1) NOT NULL"), sql);
    assertFalse(sql.contains("PRIMARY KEY"), sql);
  }

  @Test
  void nullOptionsMeanDefaults() {
    assertEquals("CREATE TABLE marker ();", d.createTable(new Table("marker", List.of(), null), null));
  }

  @Test
  void unrenderableTypeIsRejected() {
    Table t = new Table("doc", List.of(new Column("body", SqlType.JSONB, false)), null);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> d.createTable(t, DdlOptions.DEFAULT));
    assertTrue(ex.getMessage().contains("plain"));
  }

  @Test
  void rendersAlterActionsInOrder() {
    TableChange c = new TableChange("user",
        List.of(new Column("email", SqlType.TEXT, true)),
        List.of(new Column("age", SqlType.INTEGER, false)),
        List.of("legacy"));

    assertEquals("""
        ALTER TABLE user
          ADD COLUMN email TEXT,
          ALTER COLUMN age TYPE INTEGER,
          ALTER COLUMN age SET NOT NULL,
          DROP COLUMN legacy;""", d.alterTable(c, DdlOptions.DEFAULT));
  }

  @Test
  void emptyChangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> d.alterTable(new TableChange("t", null, null, null), DdlOptions.DEFAULT));
  }

  @Test
  void blankSchemaIsIgnored() {
    assertNull(new DdlOptions("  ", false).schema());
    assertEquals("app", DdlOptions.DEFAULT.withSchema(" app ").schema());
  }
}
