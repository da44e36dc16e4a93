package io.intellixity.quarry.query;

import java.util.*;

/**
 * Fluent description of a SELECT (or COUNT) over one model.
 * <p>
 * {@code select == null} projects every non-collection column; an explicit list always gains the primary key.
 */
public final class SelectQuery {
  private List<String> select;
  private Map<String, ?> where;
  private List<SortField> sort = new ArrayList<>();
  private Paging paging = Paging.NONE;
  private List<JoinDefinition> joins = new ArrayList<>();
  private List<String> distinctOn = new ArrayList<>();
  private boolean withTotalCount;

  public SelectQuery() {}

  public List<String> select() { return select; }
  public Map<String, ?> where() { return where; }
  public List<SortField> sort() { return sort; }
  public Paging paging() { return paging; }
  public List<JoinDefinition> joins() { return joins; }
  public List<String> distinctOn() { return distinctOn; }
  /** Adds {@code COUNT(*) OVER()} so each row carries the unpaged match count. */
  public boolean withTotalCount() { return withTotalCount; }

  public SelectQuery withSelect(List<String> select) { this.select = select == null ? null : new ArrayList<>(select); return this; }
  public SelectQuery withSelect(String... select) { return withSelect(List.of(select)); }
  public SelectQuery withWhere(Map<String, ?> where) { this.where = where; return this; }
  public SelectQuery withSort(Object sort) { this.sort = new ArrayList<>(Sorts.parse(sort)); return this; }
  public SelectQuery withPaging(Paging paging) { this.paging = paging == null ? Paging.NONE : paging; return this; }
  public SelectQuery withLimit(Object limit) { this.paging = paging.withLimit(limit); return this; }
  public SelectQuery withSkip(Object skip) { this.paging = paging.withSkip(skip); return this; }
  public SelectQuery withJoin(JoinDefinition join) { this.joins.add(Objects.requireNonNull(join, "join")); return this; }
  public SelectQuery withJoins(List<JoinDefinition> joins) { this.joins = new ArrayList<>(joins == null ? List.of() : joins); return this; }
  public SelectQuery withDistinctOn(String... properties) { this.distinctOn = new ArrayList<>(List.of(properties)); return this; }
  public SelectQuery withTotalCount(boolean enabled) { this.withTotalCount = enabled; return this; }

  public static SelectQuery where(Map<String, ?> where) {
    return new SelectQuery().withWhere(where);
  }
}
