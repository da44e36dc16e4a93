package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.*;
import io.intellixity.quarry.query.Paging;
import io.intellixity.quarry.query.SelectQuery;
import io.intellixity.quarry.schema.ModelMetadata;

import java.util.function.Function;

/**
 * {@code SELECT [DISTINCT ON (...)] cols FROM table [joins] [WHERE] [ORDER BY] [LIMIT] [OFFSET]}.\n
 *
 * Join parameters are numbered before WHERE parameters, matching their position in the SQL text.\n
 */
public final class SelectStatementBuilder {
  static final String TOTAL_COUNT_COLUMN = "__total_count__";

  private final PredicateCompiler compiler;

  public SelectStatementBuilder(PredicateCompiler compiler) {
    this.compiler = compiler;
  }

  public QueryAndParams build(ModelMetadata model, SelectQuery query) {
    ParamAccumulator params = new ParamAccumulator();
    JoinResolver joins = compiler.joins(model, query.joins());
    Function<String, String> columnSql = p -> compiler.columnSql(model, joins, p);

    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(Ordering.distinctOn(query.distinctOn(), query.sort(), columnSql, model.name()));
    sql.append(ColumnListBuilder.columns(model, query.select()));
    if (query.withTotalCount()) {
      sql.append(",COUNT(*) OVER() AS ").append(PgIdentifiers.quote(TOTAL_COUNT_COLUMN));
    }
    sql.append(" FROM ").append(PgIdentifiers.table(model));
    sql.append(joins.render(compiler, params));
    sql.append(compiler.whereClause(model, query.where(), params, joins));
    sql.append(Ordering.orderBy(query.sort(), columnSql));

    Paging paging = query.paging();
    if (paging.hasLimit()) sql.append(" LIMIT ").append(paging.limit());
    if (paging.hasSkip()) sql.append(" OFFSET ").append(paging.skip());
    return new QueryAndParams(sql.toString(), params.values());
  }
}
