package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.PostgresQueryBuilder;
import io.intellixity.quarry.postgres.QueryAndParams;
import io.intellixity.quarry.query.*;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.InMemoryModelRegistry;
import io.intellixity.quarry.schema.ModelMetadata;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static io.intellixity.quarry.postgres.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

final class InsertStatementBuilderTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
  private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
  private static final String PRODUCT_COLUMNS =
      "\"id\",\"name\",\"sku\",\"location\",\"alias_names\" AS \"aliases\",\"store_id\" AS \"store\"";

  private final PostgresQueryBuilder builder = new PostgresQueryBuilder(REGISTRY, Clock.fixed(NOW, ZoneOffset.UTC));

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void singleRowWithReturning() {
    QueryAndParams r = builder.insert("Product", InsertCommand.of(row("name", "widget", "store", 1)));
    assertEquals("INSERT INTO \"products\" (\"name\",\"store_id\") VALUES ($1,$2) RETURNING " + PRODUCT_COLUMNS, r.query());
    assertEquals(List.of("widget", 1), r.params());
  }

  @Test
  void returningCanBeNarrowedOrDisabled() {
    assertEquals("INSERT INTO \"products\" (\"name\",\"store_id\") VALUES ($1,$2) RETURNING \"name\",\"id\"",
        builder.insert("Product", InsertCommand.of(row("name", "w", "store", 1)).withReturnSelect("name")).query());
    assertEquals("INSERT INTO \"products\" (\"name\",\"store_id\") VALUES ($1,$2)",
        builder.insert("Product", InsertCommand.of(row("name", "w", "store", 1)).withReturnRecords(false)).query());
  }

  @Test
  void multipleRowsNumberRowByRow() {
    QueryAndParams r = builder.insert("Product", new InsertCommand()
        .withRows(List.of(row("name", "a", "store", 1), row("name", "b", "sku", "B-1", "store", 2)))
        .withReturnRecords(false));
    assertEquals("INSERT INTO \"products\" (\"name\",\"sku\",\"store_id\") VALUES ($1,NULL,$2),($3,$4,$5)", r.query());
    assertEquals(List.of("a", 1, "b", "B-1", 2), r.params());
  }

  @Test
  void explicitNullRendersLiteral() {
    QueryAndParams r = builder.insert("Product",
        InsertCommand.of(row("name", "a", "sku", null, "store", 1)).withReturnRecords(false));
    assertEquals("INSERT INTO \"products\" (\"name\",\"sku\",\"store_id\") VALUES ($1,NULL,$2)", r.query());
    assertEquals(List.of("a", 1), r.params());
  }

  @Test
  void missingRequiredValueFails() {
    RequiredValueException ex = assertThrows(RequiredValueException.class,
        () -> builder.insert("Product", InsertCommand.of(row("store", 1))));
    assertEquals("Create statement for \"Product\" is missing value for required field: name", ex.getMessage());
    assertEquals("name", ex.property());
  }

  @Test
  void maxLengthIsEnforcedForStringsAndStringArrays() {
    TypeConstraintException ex = assertThrows(TypeConstraintException.class,
        () -> builder.insert("Product", InsertCommand.of(row("name", "x".repeat(51), "store", 1))));
    assertEquals("Create statement for \"Product\" contains a value that exceeds maxLength on field: name", ex.getMessage());

    assertThrows(TypeConstraintException.class,
        () -> builder.insert("KitchenSink", InsertCommand.of(row("stringArray", List.of("ok", "too long")))));
    assertDoesNotThrow(() -> builder.insert("Product", InsertCommand.of(row("name", "x".repeat(50), "store", 1))));
  }

  @Test
  void hydratedRelationIsReducedToKey() {
    QueryAndParams r = builder.insert("Product",
        InsertCommand.of(row("name", "a", "store", row("id", 9, "name", "Acme"))).withReturnRecords(false));
    assertEquals(List.of("a", 9), r.params());

    TypeConstraintException ex = assertThrows(TypeConstraintException.class,
        () -> builder.insert("Product", InsertCommand.of(row("name", "a", "store", row("name", "Acme")))));
    assertTrue(ex.getMessage().contains("Undefined primary key value for hydrated object value for \"store\" on \"Product\""));
  }

  @Test
  void defaultsTimestampsAndVersion() {
    QueryAndParams r = builder.insert("KitchenSink", InsertCommand.of(row("name", "sink")).withReturnRecords(false));
    assertEquals("INSERT INTO \"kitchen_sink\" (\"name\",\"status\",\"created_at\",\"updated_at\",\"version\") "
        + "VALUES ($1,$2,$3,$4,$5)", r.query());
    assertEquals(List.of("sink", "draft", NOW_UTC, NOW_UTC, 1), r.params());
  }

  @Test
  void factoryDefaultIsUsed() {
    AtomicInteger calls = new AtomicInteger();
    ModelMetadata ticket = ModelMetadata.builder("Ticket")
        .table("tickets")
        .column(ColumnMetadata.builder("id").type("integer").primary())
        .column(ColumnMetadata.builder("code").type("string").required().defaultsTo(() -> "T-" + calls.incrementAndGet()))
        .build();
    PostgresQueryBuilder local = new PostgresQueryBuilder(InMemoryModelRegistry.of(ticket));
    QueryAndParams r = local.insert("Ticket", new InsertCommand().withRows(List.of(row(), row())).withReturnRecords(false));
    assertEquals("INSERT INTO \"tickets\" (\"code\") VALUES ($1),($2)", r.query());
    assertEquals(List.of("T-1", "T-1"), r.params());
  }

  @Test
  void jsonArrayIsSerialized() {
    QueryAndParams r = builder.insert("KitchenSink",
        InsertCommand.of(row("bar", List.of(1, "two"), "createdAt", null, "updatedAt", null, "version", 3))
            .withReturnRecords(false));
    assertTrue(r.query().startsWith("INSERT INTO \"kitchen_sink\" (\"bar\",\"status\",\"created_at\",\"updated_at\",\"version\") "
        + "VALUES ($1::jsonb,$2,NULL,NULL,$3)"), r.query());
    assertEquals(List.of("[1,\"two\"]", "draft", 3), r.params());
  }

  @Test
  void unknownPropertyFails() {
    assertThrows(SchemaResolutionException.class,
        () -> builder.insert("Product", InsertCommand.of(row("name", "a", "store", 1, "color", "red"))));
  }

  @Test
  void emptyInsertFails() {
    assertThrows(QueryArgumentException.class, () -> builder.insert("Product", new InsertCommand()));
  }

  @Test
  void upsertDoNothing() {
    QueryAndParams r = builder.insert("Store", InsertCommand.of(row("id", 1, "name", "Acme"))
        .withOnConflict(OnConflict.ignore("id")).withReturnRecords(false));
    assertEquals("INSERT INTO \"stores\" (\"id\",\"name\") VALUES ($1,$2) ON CONFLICT (\"id\") DO NOTHING", r.query());
  }

  @Test
  void upsertMergesDefaultColumns() {
    QueryAndParams r = builder.insert("Store", InsertCommand.of(row("id", 1, "name", "Acme"))
        .withOnConflict(OnConflict.merge("id")));
    assertEquals("INSERT INTO \"stores\" (\"id\",\"name\") VALUES ($1,$2) ON CONFLICT (\"id\") "
        + "DO UPDATE SET \"name\"=EXCLUDED.\"name\" RETURNING \"id\",\"name\"", r.query());
  }

  @Test
  void upsertDefaultMergeSkipsKeyAndCreateDateAndIncrementsVersion() {
    QueryAndParams r = builder.insert("KitchenSink", InsertCommand.of(row("id", 1, "name", "a"))
        .withOnConflict(OnConflict.merge("id").mergeOnly("name", "version")).withReturnRecords(false));
    assertTrue(r.query().endsWith("ON CONFLICT (\"id\") DO UPDATE SET \"name\"=EXCLUDED.\"name\","
        + "\"version\"=\"kitchen_sink\".\"version\"+1"), r.query());

    String all = builder.insert("KitchenSink", InsertCommand.of(row("id", 1, "name", "a"))
        .withOnConflict(OnConflict.merge("id")).withReturnRecords(false)).query();
    assertFalse(all.contains("\"id\"=EXCLUDED"));
    assertFalse(all.contains("\"created_at\"=EXCLUDED"));
    assertTrue(all.contains("\"updated_at\"=EXCLUDED.\"updated_at\""));
  }

  @Test
  void upsertWithPredicates() {
    QueryAndParams r = builder.insert("Store", InsertCommand.of(row("id", 1, "name", "Acme"))
        .withOnConflict(OnConflict.merge("id")
            .targetWhere(Where.of("name", Where.not(null)))
            .mergeWhere(Where.of("name", Where.not("Locked"))))
        .withReturnRecords(false));
    assertEquals("INSERT INTO \"stores\" (\"id\",\"name\") VALUES ($1,$2) ON CONFLICT (\"id\") WHERE \"name\" IS NOT NULL "
        + "DO UPDATE SET \"name\"=EXCLUDED.\"name\" WHERE \"name\"<>$3", r.query());
    assertEquals(List.of(1, "Acme", "Locked"), r.params());
  }

  @Test
  void emptyMergeListDoesNothing() {
    OnConflict none = new OnConflict(List.of("id"), null, OnConflict.Action.MERGE, List.of(), null);
    assertTrue(builder.insert("Store", InsertCommand.of(row("id", 1)).withOnConflict(none).withReturnRecords(false))
        .query().endsWith("ON CONFLICT (\"id\") DO NOTHING"));
  }
}
