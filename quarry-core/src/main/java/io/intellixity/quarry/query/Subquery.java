package io.intellixity.quarry.query;

import io.intellixity.quarry.schema.ModelMetadata;

import java.util.*;

/**
 * Immutable description of a nested SELECT over one model.
 * <p>
 * Every mutator returns a copy, so a base subquery can be shared and refined:
 * <pre>
 *   Subquery stores = Subquery.from(store).select("id");
 *   Subquery acme = stores.where(Where.of("name", "Acme"));
 * </pre>
 */
public final class Subquery {
  private final ModelMetadata model;
  private final List<String> select;
  private final List<Aggregate> aggregates;
  private final Map<String, ?> where;
  private final List<String> groupBy;
  private final Map<String, ?> having;
  private final List<SortField> sort;
  private final Integer limit;
  private final List<String> distinctOn;

  private Subquery(ModelMetadata model, List<String> select, List<Aggregate> aggregates, Map<String, ?> where,
                   List<String> groupBy, Map<String, ?> having, List<SortField> sort, Integer limit,
                   List<String> distinctOn) {
    this.model = Objects.requireNonNull(model, "model");
    this.select = select;
    this.aggregates = aggregates;
    this.where = where;
    this.groupBy = groupBy;
    this.having = having;
    this.sort = sort;
    this.limit = limit;
    this.distinctOn = distinctOn;
  }

  public static Subquery from(ModelMetadata model) {
    return new Subquery(model, List.of(), List.of(), null, List.of(), null, List.of(), null, List.of());
  }

  public ModelMetadata model() { return model; }
  /** Selected properties in declaration order. */
  public List<String> select() { return select; }
  public List<Aggregate> aggregates() { return aggregates; }
  public Map<String, ?> where() { return where; }
  public List<String> groupBy() { return groupBy; }
  public Map<String, ?> having() { return having; }
  public List<SortField> sort() { return sort; }
  /** Row limit, or null for none. */
  public Integer limit() { return limit; }
  public List<String> distinctOn() { return distinctOn; }

  /** Number of projected output columns (properties plus aggregates). */
  public int projectionSize() {
    return select.size() + aggregates.size();
  }

  /**
   * Replaces the projection. Items are property names ({@link String}) or {@link Aggregate}s; the output keeps
   * properties first, then aggregates.
   */
  public Subquery select(Object... items) {
    List<String> props = new ArrayList<>();
    List<Aggregate> aggs = new ArrayList<>();
    for (Object item : items) {
      if (item instanceof String s) props.add(s);
      else if (item instanceof Aggregate a) aggs.add(a);
      else throw new StructuralException("Unsupported subquery select item: " + item, model.name(), null);
    }
    return new Subquery(model, List.copyOf(props), List.copyOf(aggs), where, groupBy, having, sort, limit, distinctOn);
  }

  public Subquery where(Map<String, ?> where) {
    return new Subquery(model, select, aggregates, where, groupBy, having, sort, limit, distinctOn);
  }

  public Subquery groupBy(String... properties) {
    return new Subquery(model, select, aggregates, where, List.of(properties), having, sort, limit, distinctOn);
  }

  /**
   * HAVING conditions keyed by aggregate alias: a number for equality, or a map of {@code <, <=, >, >=, !=}
   * to numbers.
   */
  public Subquery having(Map<String, ?> having) {
    return new Subquery(model, select, aggregates, where, groupBy, having, sort, limit, distinctOn);
  }

  /** Sort given as a string ({@code "name desc"}), a property map, or a list of {@link SortField}. */
  public Subquery sort(Object sort) {
    return new Subquery(model, select, aggregates, where, groupBy, having, Sorts.parse(sort), limit, distinctOn);
  }

  public Subquery limit(int maxRows) {
    if (maxRows < 0) throw new QueryArgumentException("Subquery limit should be a non-negative number");
    return new Subquery(model, select, aggregates, where, groupBy, having, sort, maxRows, distinctOn);
  }

  /** Keeps the first row per distinct value of {@code properties}; they must lead the sort. */
  public Subquery distinctOn(String... properties) {
    return new Subquery(model, select, aggregates, where, groupBy, having, sort, limit, List.of(properties));
  }

  public ScalarSubquery count() { return new ScalarSubquery(this, Aggregate.count()); }
  public ScalarSubquery sum(String property) { return new ScalarSubquery(this, Aggregate.sum(property)); }
  public ScalarSubquery avg(String property) { return new ScalarSubquery(this, Aggregate.avg(property)); }
  public ScalarSubquery max(String property) { return new ScalarSubquery(this, Aggregate.max(property)); }
  public ScalarSubquery min(String property) { return new ScalarSubquery(this, Aggregate.min(property)); }

  @Override
  public String toString() {
    return "Subquery[" + model.name() + " select=" + select + " aggregates=" + aggregates + "]";
  }
}
