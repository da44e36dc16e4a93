package io.intellixity.quarry.query;

import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class WhereTest {

  @Test
  void classifiesReservedKeys() {
    assertEquals(WhereKey.NOT, WhereKey.classify("!"));
    assertEquals(WhereKey.NOT, WhereKey.classify("not"));
    assertEquals(WhereKey.STARTS_WITH, WhereKey.classify("startsWith"));
    assertEquals(WhereKey.GREATER_THAN_OR_EQUAL, WhereKey.classify(">="));
    assertEquals(WhereKey.PROPERTY, WhereKey.classify("name"));
    assertEquals(WhereKey.PROPERTY, WhereKey.classify("store.name"));
    assertTrue(WhereKey.LESS_THAN.isOrdering());
    assertFalse(WhereKey.LIKE.isOrdering());
  }

  @Test
  void helpersBuildNullTolerantMaps() {
    Map<String, Object> w = Where.of("name", null, "sku", Where.not(Where.like("a%")));
    assertTrue(w.containsKey("name"));
    assertNull(w.get("name"));
    assertEquals(Map.of("not", Map.of("like", "a%")), w.get("sku"));
    assertEquals(Arrays.asList("a", null), Where.anyOf("a", null));
  }

  @Test
  void parsesWhereJson() {
    Map<String, Object> w = WhereJson.parse("{\"or\":[{\"name\":\"a\"},{\"sku\":{\"<\":5}}]}");
    assertEquals(List.of(Map.of("name", "a"), Map.of("sku", Map.of("<", 5))), w.get("or"));
    assertNull(WhereJson.parse(" "));
    assertThrows(QueryArgumentException.class, () -> WhereJson.parse("[1]"));
    assertThrows(QueryArgumentException.class, () -> WhereJson.parse("{nope"));
  }

  @Test
  void foreignKeyRefs() {
    assertEquals(new ForeignKeyRef.Scalar(5), ForeignKeyRef.resolve(5, "id").orElseThrow());
    Map<String, Object> store = Map.of("id", 7, "name", "Acme");
    assertEquals(7, ForeignKeyRef.resolve(store, "id").orElseThrow().id());
    assertTrue(ForeignKeyRef.resolve(Map.of("name", "Acme"), "id").isEmpty());
  }

  @Test
  void subqueriesAreCopyOnWrite() {
    ModelMetadata store = ModelMetadata.builder("Store")
        .column(ColumnMetadata.builder("id").type("integer").primary())
        .build();
    Subquery base = Subquery.from(store);
    Subquery narrowed = base.select("id", Aggregate.count().as("n")).limit(5);
    assertEquals(0, base.projectionSize());
    assertEquals(2, narrowed.projectionSize());
    assertEquals(5, narrowed.limit());
    assertNull(base.limit());
    assertEquals("count", Aggregate.count().alias());
    assertThrows(StructuralException.class, () -> base.select(42));
    assertThrows(IllegalArgumentException.class, () -> Aggregate.sum(null));
  }

  @Test
  void subqueryLimitMustNotBeNegative() {
    ModelMetadata store = ModelMetadata.builder("Store")
        .column(ColumnMetadata.builder("id").type("integer").primary())
        .build();
    assertThrows(QueryArgumentException.class, () -> Subquery.from(store).limit(-1));
    assertEquals(0, Subquery.from(store).limit(0).limit());
  }

  @Test
  void aggregateDistinctKeepsAlias() {
    Aggregate a = Aggregate.sum("price").as("total").withDistinct();
    assertTrue(a.distinct());
    assertEquals("total", a.alias());
    assertFalse(Aggregate.sum("price").distinct());
    assertThrows(IllegalArgumentException.class, () -> Aggregate.count().withDistinct());
  }

  @Test
  void joinDefaults() {
    JoinDefinition.ModelJoin j = JoinDefinition.inner("store");
    assertEquals("store", j.alias());
    assertEquals(JoinType.INNER, j.type());
    assertEquals("LEFT JOIN", JoinDefinition.left("store", "s").type().sql());
  }
}
