package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.*;
import io.intellixity.quarry.schema.ModelMetadata;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.quarry.postgres.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

final class SubqueryRendererTest {
  private final PredicateCompiler compiler = new PredicateCompiler(REGISTRY);

  private QueryAndParams compile(ModelMetadata model, Map<String, ?> where) {
    ParamAccumulator params = new ParamAccumulator();
    String sql = compiler.compile(model, where, params);
    return new QueryAndParams(sql, params.values());
  }

  @Test
  void inSubquery() {
    Subquery stores = Subquery.from(STORE).select("id").where(Where.of("name", "Acme"));
    QueryAndParams r = compile(PRODUCT, Where.of("store", Where.in(stores)));
    assertEquals("\"store_id\" IN (SELECT \"id\" FROM \"stores\" WHERE \"name\"=$1)", r.query());
    assertEquals(List.of("Acme"), r.params());

    assertEquals("\"store_id\" NOT IN (SELECT \"id\" FROM \"stores\" WHERE \"name\"=$1)",
        compile(PRODUCT, Where.of("store", Where.not(Where.in(stores)))).query());
  }

  @Test
  void inSubqueryRequiresSingleColumn() {
    Subquery wide = Subquery.from(STORE).select("id", "name");
    StructuralException ex = assertThrows(StructuralException.class,
        () -> compile(PRODUCT, Where.of("store", Where.in(wide))));
    assertTrue(ex.getMessage().contains("exactly one column"));
    assertThrows(StructuralException.class,
        () -> compile(PRODUCT, Where.of("store", Where.in(Subquery.from(STORE)))));
  }

  @Test
  void inAcceptsPlainList() {
    assertEquals("\"store_id\"=ANY($1::INTEGER[])",
        compile(PRODUCT, Where.of("store", Where.of("in", List.of(1, 2)))).query());
  }

  @Test
  void existsSubquery() {
    Subquery products = Subquery.from(PRODUCT).where(Where.of("name", "widget"));
    assertEquals("EXISTS (SELECT 1 FROM \"products\" WHERE \"name\"=$1)", compile(STORE, Where.exists(products)).query());
    assertEquals("NOT EXISTS (SELECT 1 FROM \"products\" WHERE \"name\"=$1)",
        compile(STORE, Where.not(Where.exists(products))).query());
  }

  @Test
  void scalarSubqueryComparison() {
    Subquery sinks = Subquery.from(KITCHEN_SINK).where(Where.of("name", "x"));
    QueryAndParams r = compile(KITCHEN_SINK, Where.of("intColumn", Where.gt(sinks.avg("intColumn"))));
    assertEquals("\"int_column\">(SELECT AVG(\"int_column\") FROM \"kitchen_sink\" WHERE \"name\"=$1)", r.query());

    assertEquals("\"int_column\"<=(SELECT COUNT(*) FROM \"kitchen_sink\" WHERE \"name\"=$1)",
        compile(KITCHEN_SINK, Where.of("intColumn", Where.not(Where.gt(sinks.count())))).query());
    assertEquals("\"int_column\"=(SELECT MAX(\"int_column\") FROM \"kitchen_sink\" WHERE \"name\"=$1)",
        compile(KITCHEN_SINK, Where.of("intColumn", sinks.max("intColumn"))).query());
  }

  @Test
  void scalarSubqueryRejectsExtraProjection() {
    ScalarSubquery bad = Subquery.from(KITCHEN_SINK).select("name").sum("intColumn");
    assertThrows(StructuralException.class, () -> compile(KITCHEN_SINK, Where.of("intColumn", Where.lt(bad))));
  }

  @Test
  void subquerySortAndLimit() {
    Subquery top = Subquery.from(STORE).select("id").where(Where.of("name", Where.like("A%"))).sort("name").limit(10);
    assertEquals("\"store_id\" IN (SELECT \"id\" FROM \"stores\" WHERE \"name\" ILIKE $1 ORDER BY \"name\" LIMIT 10)",
        compile(PRODUCT, Where.of("store", Where.in(top))).query());
  }

  @Test
  void subqueryParamsShareParentNumbering() {
    Subquery stores = Subquery.from(STORE).select("id").where(Where.of("name", "Acme"));
    QueryAndParams r = compile(PRODUCT, Where.of("name", "widget", "store", Where.in(stores)));
    assertEquals("\"name\"=$1 AND \"store_id\" IN (SELECT \"id\" FROM \"stores\" WHERE \"name\"=$2)", r.query());
    assertEquals(List.of("widget", "Acme"), r.params());
  }

  @Test
  void nestedSubqueries() {
    Subquery acmeStores = Subquery.from(STORE).select("id").where(Where.of("name", "Acme"));
    Subquery acmeProducts = Subquery.from(PRODUCT).select("id").where(Where.of("store", Where.in(acmeStores)));
    assertEquals("\"product_id\" IN (SELECT \"id\" FROM \"products\" WHERE \"store_id\" IN "
            + "(SELECT \"id\" FROM \"stores\" WHERE \"name\"=$1))",
        compile(CATEGORY, Where.of("product", Where.in(acmeProducts))).query());
  }

  @Test
  void derivedTableWithAggregatesAndHaving() {
    Subquery stats = Subquery.from(PRODUCT)
        .select("store", Aggregate.count().as("productCount"))
        .groupBy("store")
        .having(Map.of("productCount", Map.of(">", 5)));
    ParamAccumulator params = new ParamAccumulator();
    assertEquals("SELECT \"store_id\" AS \"store\",COUNT(*) AS \"productCount\" FROM \"products\" "
            + "GROUP BY \"store_id\" HAVING COUNT(*)>5",
        compiler.subqueries().renderDerived(stats, params));
    assertEquals(0, params.size());
  }

  @Test
  void havingForms() {
    Subquery base = Subquery.from(PRODUCT).select("store", Aggregate.count().as("n")).groupBy("store");
    assertTrue(derived(base.having(Map.of("n", 5))).endsWith("HAVING COUNT(*)=5"));
    assertTrue(derived(base.having(Map.of("n", Map.of("!=", 2.0)))).endsWith("HAVING COUNT(*)<>2"));
    Map<String, Object> bounds = new LinkedHashMap<>();
    bounds.put(">=", 5);
    bounds.put("<=", 100);
    String range = derived(base.having(Map.of("n", bounds)));
    assertTrue(range.endsWith("HAVING COUNT(*)>=5 AND COUNT(*)<=100"));
  }

  @Test
  void havingValidation() {
    Subquery base = Subquery.from(PRODUCT).select("store", Aggregate.count().as("n")).groupBy("store");
    assertTrue(assertThrows(StructuralException.class, () -> derived(base.having(Map.of("n", Map.of("~", 1)))))
        .getMessage().contains("Invalid HAVING operator"));
    assertTrue(assertThrows(StructuralException.class, () -> derived(base.having(Map.of("n", Double.NaN))))
        .getMessage().contains("must be a finite number"));
    assertTrue(assertThrows(StructuralException.class, () -> derived(base.having(Map.of("n", "5"))))
        .getMessage().contains("must be a finite number"));
    assertTrue(assertThrows(StructuralException.class, () -> derived(base.having(Map.of("total", 1))))
        .getMessage().contains("unknown alias"));
  }

  @Test
  void aggregateAliasMustBeIdentifier() {
    Subquery bad = Subquery.from(PRODUCT).select("store", Aggregate.count().as("n; DROP TABLE x")).groupBy("store");
    assertTrue(assertThrows(StructuralException.class, () -> derived(bad)).getMessage().contains("Invalid SQL identifier"));
  }

  @Test
  void countDistinctAndExtraGroupColumns() {
    Subquery s = Subquery.from(PRODUCT)
        .select("store", "name", Aggregate.countDistinct("name").as("uniqueNames"))
        .groupBy("store", "name");
    assertEquals("SELECT \"store_id\" AS \"store\",\"name\",COUNT(DISTINCT \"name\") AS \"uniqueNames\" FROM \"products\" "
        + "GROUP BY \"store_id\",\"name\"", derived(s));
  }

  @Test
  void distinctOnInsideSubquery() {
    Subquery latest = Subquery.from(PRODUCT).select("store", "name").distinctOn("store").sort("store asc, name desc");
    assertEquals("SELECT DISTINCT ON (\"store_id\") \"store_id\" AS \"store\",\"name\" FROM \"products\" "
        + "ORDER BY \"store_id\",\"name\" DESC", derived(latest));
    assertThrows(StructuralException.class,
        () -> derived(Subquery.from(PRODUCT).select("store").distinctOn("store")));
  }

  private String derived(Subquery sq) {
    return compiler.subqueries().renderDerived(sq, new ParamAccumulator());
  }
}
