package io.intellixity.quarry.postgres;

import io.intellixity.quarry.postgres.statement.*;
import io.intellixity.quarry.query.*;
import io.intellixity.quarry.schema.ModelMetadata;
import io.intellixity.quarry.schema.ModelRegistry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for building Postgres statements against a {@link ModelRegistry}.\n
 *
 * Every call allocates its own {@link ParamAccumulator}; the builder is stateless and thread-safe.\n
 */
public final class PostgresQueryBuilder {
  private final ModelRegistry registry;
  private final PredicateCompiler compiler;
  private final SelectStatementBuilder select;
  private final CountStatementBuilder count;
  private final InsertStatementBuilder insert;
  private final UpdateStatementBuilder update;
  private final DeleteStatementBuilder delete;

  public PostgresQueryBuilder(ModelRegistry registry) {
    this(registry, Clock.systemUTC());
  }

  /** {@code clock} supplies create/update timestamps. */
  public PostgresQueryBuilder(ModelRegistry registry, Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(clock, "clock");
    this.compiler = new PredicateCompiler(registry);
    this.select = new SelectStatementBuilder(compiler);
    this.count = new CountStatementBuilder(compiler);
    this.insert = new InsertStatementBuilder(compiler, clock);
    this.update = new UpdateStatementBuilder(compiler, clock);
    this.delete = new DeleteStatementBuilder(compiler);
  }

  public ModelRegistry registry() { return registry; }

  public QueryAndParams select(String model, SelectQuery query) { return select.build(registry.model(model), query); }
  public QueryAndParams count(String model, SelectQuery query) { return count.build(registry.model(model), query); }
  public QueryAndParams insert(String model, InsertCommand command) { return insert.build(registry.model(model), command); }
  public QueryAndParams update(String model, UpdateCommand command) { return update.build(registry.model(model), command); }
  public QueryAndParams delete(String model, DeleteCommand command) { return delete.build(registry.model(model), command); }

  /** Standalone WHERE clause ({@code " WHERE ..."} or empty) with its own parameter numbering. */
  public QueryAndParams where(String model, Map<String, ?> where) {
    return where(model, where, List.of());
  }

  public QueryAndParams where(String model, Map<String, ?> where, List<JoinDefinition> joins) {
    ModelMetadata m = registry.model(model);
    ParamAccumulator params = new ParamAccumulator();
    String sql = compiler.whereClause(m, where, params, compiler.joins(m, joins));
    return new QueryAndParams(sql, params.values());
  }

  /** JOIN clauses alone, each with a leading space. */
  public QueryAndParams joins(String model, List<JoinDefinition> joins) {
    ModelMetadata m = registry.model(model);
    ParamAccumulator params = new ParamAccumulator();
    String sql = compiler.joins(m, joins).render(compiler, params);
    return new QueryAndParams(sql, params.values());
  }
}
