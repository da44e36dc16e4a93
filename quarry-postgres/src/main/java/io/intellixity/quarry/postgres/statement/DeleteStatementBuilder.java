package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.*;
import io.intellixity.quarry.query.DeleteCommand;
import io.intellixity.quarry.schema.ModelMetadata;

public final class DeleteStatementBuilder {
  private final PredicateCompiler compiler;

  public DeleteStatementBuilder(PredicateCompiler compiler) {
    this.compiler = compiler;
  }

  public QueryAndParams build(ModelMetadata model, DeleteCommand command) {
    ParamAccumulator params = new ParamAccumulator();
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(PgIdentifiers.table(model));
    String where = compiler.compile(model, command.where(), params);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);
    if (command.returnRecords()) {
      sql.append(" RETURNING ").append(ColumnListBuilder.columns(model, command.returnSelect()));
    }
    return new QueryAndParams(sql.toString(), params.values());
  }
}
