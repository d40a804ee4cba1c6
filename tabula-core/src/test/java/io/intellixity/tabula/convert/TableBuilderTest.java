package io.intellixity.tabula.convert;

import io.intellixity.tabula.schema.Column;
import io.intellixity.tabula.schema.SqlType;
import io.intellixity.tabula.schema.Table;
import io.intellixity.tabula.shape.Attribute;
import io.intellixity.tabula.shape.Shape;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.tabula.shape.Shapes.*;
import static org.junit.jupiter.api.Assertions.*;

final class TableBuilderTest {
  private final TableBuilder builder = new TableBuilder();

  @Test
  void userRecordWithoutAttributesHasNoPrimaryKey() {
    Shape user = record("User",
        field("id", u64()),
        field("username", string()),
        field("is_active", bool()));

    Table t = builder.convert(user);

    assertEquals("user", t.name());
    assertEquals(List.of(
        new Column("id", SqlType.BIGINT, false),
        new Column("username", SqlType.TEXT, false),
        new Column("is_active", SqlType.BOOLEAN, false)
    ), t.columns());
    assertNull(t.primaryKey());
    assertTrue(t.primaryKeyColumn().isEmpty());
  }

  @Test
  void blogPostPrimaryKeyReferencesMarkedColumn() {
    Shape post = record("BlogPost",
        primaryKey("id", string()),
        field("title", string()));

    Table t = builder.convert(post);

    assertEquals("blogpost", t.name());
    assertEquals(new Column("id", SqlType.TEXT, false), t.primaryKey());
    assertSame(t.columns().get(0), t.primaryKey());
    assertEquals(new Column("title", SqlType.TEXT, false), t.columns().get(1));
  }

  @Test
  void sequenceAndNestedRecordFieldsBecomeJsonb() {
    Shape address = record("Address", field("street", string()), field("zip", u32()));
    Shape org = record("Organization",
        field("tags", list(string())),
        field("address", address));

    Table t = builder.convert(org);

    assertEquals(SqlType.JSONB, t.column("tags").orElseThrow().dataType());
    assertEquals(SqlType.JSONB, t.column("address").orElseThrow().dataType());
  }

  @Test
  void fixedLengthArrayFieldIsUnsupported() {
    Shape s = record("FixedSizeArrays", field("id", u32()), field("rgb", array(u8(), 3)));

    ConversionException ex = assertThrows(ConversionException.class, () -> builder.convert(s));
    assertEquals(ConversionException.Kind.UNSUPPORTED_TYPE, ex.kind());
    assertTrue(ex.getMessage().startsWith("Unsupported type: "));
  }

  @Test
  void twoPrimaryKeysFailWithoutPartialTable() {
    Shape s = record("DoublePk", primaryKey("id1", u64()), primaryKey("id2", u64()));

    ConversionException ex = assertThrows(ConversionException.class, () -> builder.convert(s));
    assertEquals(ConversionException.Kind.MULTIPLE_PRIMARY_KEYS, ex.kind());
    assertTrue(ex.getMessage().contains("Table 'doublepk' has 2 primary keys: [id1, id2]"));
  }

  @Test
  void threePrimaryKeysAlsoFail() {
    Shape s = record("Triple", primaryKey("a", u8()), primaryKey("b", u8()), primaryKey("c", u8()));

    ConversionException ex = assertThrows(ConversionException.class, () -> builder.convert(s));
    assertEquals(ConversionException.Kind.MULTIPLE_PRIMARY_KEYS, ex.kind());
  }

  @Test
  void topLevelTaggedTypeIsNotAStruct() {
    Shape status = unitTagged("Status", "Active", "Inactive");

    ConversionException ex = assertThrows(ConversionException.class, () -> builder.convert(status));
    assertEquals(ConversionException.Kind.NOT_A_STRUCT, ex.kind());
    assertTrue(ex.getMessage().startsWith("Expected struct, got: tagged"));
  }

  @Test
  void taggedTypeWithDataVariantsIsNotAStruct() {
    Shape role = tagged("UserRole",
        variant("Admin", field("level", u8())),
        variant("Guest"));

    assertEquals(ConversionException.Kind.NOT_A_STRUCT,
        assertThrows(ConversionException.class, () -> builder.convert(role)).kind());
  }

  @Test
  void primitiveAndOptionalTopLevelShapesAreNotStructs() {
    assertEquals(ConversionException.Kind.NOT_A_STRUCT,
        assertThrows(ConversionException.class, () -> builder.convert(u32())).kind());
    assertEquals(ConversionException.Kind.NOT_A_STRUCT,
        assertThrows(ConversionException.class, () -> builder.convert(option(record("A")))).kind());
  }

  @Test
  void optionalFieldsAreNullableWithInnerType() {
    Shape s = record("OptionalFields",
        field("required_name", string()),
        field("optional_email", option(string())),
        field("optional_age", option(u32())),
        field("optional_score", option(f64())),
        field("optional_active", option(bool())));

    Table t = builder.convert(s);

    assertFalse(t.column("required_name").orElseThrow().nullable());
    assertEquals(new Column("optional_email", SqlType.TEXT, true), t.column("optional_email").orElseThrow());
    assertEquals(new Column("optional_age", SqlType.INTEGER, true), t.column("optional_age").orElseThrow());
    assertEquals(new Column("optional_score", SqlType.DOUBLE_PRECISION, true), t.column("optional_score").orElseThrow());
    assertEquals(new Column("optional_active", SqlType.BOOLEAN, true), t.column("optional_active").orElseThrow());
  }

  @Test
  void optionalColumnTypeEqualsMappedInnerType() {
    TypeMapper mapper = new TypeMapper();
    for (Shape inner : List.of(u8(), i64(), f32(), character(), strRef(), list(u32()), map(string(), u64()),
        record("Nested"), unitTagged("Color", "Red"))) {
      Column c = builder.column(field("x", option(inner)));
      assertTrue(c.nullable(), inner.toString());
      assertEquals(mapper.map(inner), c.dataType(), inner.toString());
      assertEquals(SqlType.nullable(mapper.map(inner)), c.effectiveType());
    }
  }

  @Test
  void optionalPrimaryKeyIsAllowed() {
    Table t = builder.convert(record("Weird", primaryKey("id", option(u64()))));

    assertEquals(new Column("id", SqlType.BIGINT, true), t.primaryKey());
  }

  @Test
  void fieldOrderIsPreserved() {
    Table t = builder.convert(record("Coordinates",
        field("z", f64()), field("x", f64()), field("y", f64())));

    assertEquals(List.of("z", "x", "y"), t.columns().stream().map(Column::name).toList());
  }

  @Test
  void emptyRecordProducesEmptyTable() {
    Table t = builder.convert(record("Marker"));

    assertEquals("marker", t.name());
    assertTrue(t.columns().isEmpty());
    assertNull(t.primaryKey());
  }

  @Test
  void genericArgumentsAreDroppedFromTableName() {
    assertEquals("container", builder.convert(record("Container<u64>", field("value", u64()))).name());
    assertEquals("container", builder.convert(record("Container<String>", field("value", string()))).name());
  }

  @Test
  void taggedFieldBecomesIntegerColumn() {
    Shape s = record("UserWithStatus",
        primaryKey("id", u64()),
        field("status", unitTagged("Status", "Active", "Inactive")));

    Table t = builder.convert(s);

    assertEquals(new Column("status", SqlType.INTEGER, false), t.column("status").orElseThrow());
  }

  @Test
  void borrowedFieldsConvertWithPrimaryKey() {
    Shape s = record("BorrowedData",
        primaryKey("id", u64()),
        field("name", strRef()),
        field("label", text("Cow<str>")));

    Table t = builder.convert(s);

    assertEquals("id", t.primaryKey().name());
    assertEquals(SqlType.TEXT, t.column("name").orElseThrow().dataType());
    assertEquals(SqlType.TEXT, t.column("label").orElseThrow().dataType());
  }

  @Test
  void primaryKeyNeedsExactNamespaceAndKey() {
    Shape s = record("Loose",
        field("a", u32(), Attribute.of(null, Attribute.PRIMARY_KEY)),
        field("b", u32(), Attribute.of("PSQL", Attribute.PRIMARY_KEY)),
        field("c", u32(), Attribute.of(Attribute.SCHEMA_NAMESPACE, "Primary_Key")),
        field("d", u32(), Attribute.of("serde", "rename")));

    assertNull(builder.convert(s).primaryKey());
  }

  @Test
  void unsupportedTypeWinsOverLaterFields() {
    Shape s = record("Broken",
        primaryKey("a", u32()),
        field("b", never()),
        primaryKey("c", u32()));

    ConversionException ex = assertThrows(ConversionException.class, () -> builder.convert(s));
    assertEquals(ConversionException.Kind.UNSUPPORTED_TYPE, ex.kind());
  }
}
