package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.*;
import io.intellixity.quarry.query.StructuralException;
import io.intellixity.quarry.query.UpdateCommand;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;

import static io.intellixity.quarry.postgres.PgIdentifiers.quote;

/**
 * {@code UPDATE table SET ... [WHERE ...] [RETURNING ...]}.
 * <p>
 * Update-date columns absent from the values are set to the current time. Version columns named in the values are
 * incremented in place ({@code "v"="v"+1}) instead of being assigned. Collection properties are skipped.
 */
public final class UpdateStatementBuilder {
  private final PredicateCompiler compiler;
  private final Clock clock;

  public UpdateStatementBuilder(PredicateCompiler compiler, Clock clock) {
    this.compiler = compiler;
    this.clock = clock;
  }

  public QueryAndParams build(ModelMetadata model, UpdateCommand command) {
    InsertStatementBuilder.checkProperties(model, command.values());
    Map<String, Object> values = new LinkedHashMap<>(command.values());
    for (ColumnMetadata c : model.updateDateColumns()) {
      values.putIfAbsent(c.propertyName(), OffsetDateTime.now(clock));
    }
    ColumnValues.checkMaxLength(model, values, "Update");

    ParamAccumulator params = new ParamAccumulator();
    List<String> sets = new ArrayList<>();
    List<String> increments = new ArrayList<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      ColumnMetadata c = model.column(e.getKey());
      if (c.isCollection()) continue;
      String col = quote(c.name());
      if (c.version()) {
        increments.add(col + "=" + col + "+1");
        continue;
      }
      sets.add(col + "=" + ColumnValues.placeholder(compiler.registry(), model, c, e.getValue(), params));
    }
    sets.addAll(increments);
    if (sets.isEmpty()) {
      throw new StructuralException("Update statement for \"" + model.name() + "\" has no values to set",
          model.name(), null);
    }

    StringBuilder sql = new StringBuilder("UPDATE ").append(PgIdentifiers.table(model))
        .append(" SET ").append(String.join(",", sets));
    String where = compiler.compile(model, command.where(), params);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);
    if (command.returnRecords()) {
      sql.append(" RETURNING ").append(ColumnListBuilder.columns(model, command.returnSelect()));
    }
    return new QueryAndParams(sql.toString(), params.values());
  }
}
