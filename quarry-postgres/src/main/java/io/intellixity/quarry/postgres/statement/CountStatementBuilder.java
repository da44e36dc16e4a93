package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.*;
import io.intellixity.quarry.query.SelectQuery;
import io.intellixity.quarry.schema.ModelMetadata;

/** {@code SELECT count(*) AS "count"} over the same FROM, joins and WHERE as a select; sort and paging are ignored. */
public final class CountStatementBuilder {
  private final PredicateCompiler compiler;

  public CountStatementBuilder(PredicateCompiler compiler) {
    this.compiler = compiler;
  }

  public QueryAndParams build(ModelMetadata model, SelectQuery query) {
    ParamAccumulator params = new ParamAccumulator();
    JoinResolver joins = compiler.joins(model, query.joins());
    String sql = "SELECT count(*) AS \"count\" FROM " + PgIdentifiers.table(model)
        + joins.render(compiler, params)
        + compiler.whereClause(model, query.where(), params, joins);
    return new QueryAndParams(sql, params.values());
  }
}
