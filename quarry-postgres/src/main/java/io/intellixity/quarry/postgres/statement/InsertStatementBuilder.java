package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.*;
import io.intellixity.quarry.query.*;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;

import static io.intellixity.quarry.postgres.PgIdentifiers.quote;

/**
 * {@code INSERT INTO table (cols) VALUES (...),(...) [ON CONFLICT ...] [RETURNING ...]}.\n
 *
 * Defaults are applied per row for absent properties: the declared default (a factory default is evaluated once
 * per statement), then the current time for create/update date columns, then 1 for version columns. A column is
 * included when at least one row has a value for it; rows lacking it render {@code NULL}. Placeholders are
 * numbered row by row.\n
 */
public final class InsertStatementBuilder {
  private final PredicateCompiler compiler;
  private final Clock clock;

  public InsertStatementBuilder(PredicateCompiler compiler, Clock clock) {
    this.compiler = compiler;
    this.clock = clock;
  }

  public QueryAndParams build(ModelMetadata model, InsertCommand command) {
    if (command.rows().isEmpty()) {
      throw new QueryArgumentException("Create statement for \"" + model.name() + "\" requires at least one row");
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, ?> row : command.rows()) {
      checkProperties(model, row);
      rows.add(new LinkedHashMap<>(row));
    }

    OffsetDateTime now = OffsetDateTime.now(clock);
    List<ColumnMetadata> columns = new ArrayList<>();
    for (ColumnMetadata c : model.columns()) {
      if (c.isCollection()) continue;
      Fallback fallback = null;
      boolean include = false;
      for (Map<String, Object> row : rows) {
        if (!row.containsKey(c.propertyName())) {
          if (fallback == null) fallback = fallback(c, now);
          if (fallback.present()) {
            row.put(c.propertyName(), fallback.value());
          } else if (c.required()) {
            throw new RequiredValueException("Create statement for \"" + model.name()
                + "\" is missing value for required field: " + c.propertyName(), model.name(), c.propertyName());
          }
        }
        include |= row.containsKey(c.propertyName());
      }
      if (include) columns.add(c);
    }
    for (Map<String, Object> row : rows) ColumnValues.checkMaxLength(model, row, "Create");

    ParamAccumulator params = new ParamAccumulator();
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(PgIdentifiers.table(model));
    if (columns.isEmpty()) {
      if (rows.size() > 1) {
        throw new StructuralException("Create statement for \"" + model.name() + "\" has no values for multiple rows",
            model.name(), null);
      }
      sql.append(" DEFAULT VALUES");
    } else {
      List<String> names = new ArrayList<>();
      for (ColumnMetadata c : columns) names.add(quote(c.name()));
      sql.append(" (").append(String.join(",", names)).append(") VALUES ");
      List<String> tuples = new ArrayList<>();
      for (Map<String, Object> row : rows) {
        List<String> values = new ArrayList<>();
        for (ColumnMetadata c : columns) {
          values.add(ColumnValues.placeholder(compiler.registry(), model, c, row.get(c.propertyName()), params));
        }
        tuples.add("(" + String.join(",", values) + ")");
      }
      sql.append(String.join(",", tuples));
    }

    if (command.onConflict() != null) sql.append(onConflict(model, command.onConflict(), params));
    if (command.returnRecords()) {
      sql.append(" RETURNING ").append(ColumnListBuilder.columns(model, command.returnSelect()));
    }
    return new QueryAndParams(sql.toString(), params.values());
  }

  private String onConflict(ModelMetadata model, OnConflict conflict, ParamAccumulator params) {
    List<String> targets = new ArrayList<>();
    for (String property : conflict.targets()) targets.add(quote(ModelColumns.require(model, property).name()));
    StringBuilder sql = new StringBuilder(" ON CONFLICT (").append(String.join(",", targets)).append(")");
    String targetWhere = compiler.compile(model, conflict.targetWhere(), params);
    if (!targetWhere.isBlank()) sql.append(" WHERE ").append(targetWhere);

    List<ColumnMetadata> merge = conflict.doesNothing() ? List.of() : mergeColumns(model, conflict);
    if (merge.isEmpty()) return sql.append(" DO NOTHING").toString();

    List<String> sets = new ArrayList<>();
    for (ColumnMetadata c : merge) {
      String col = quote(c.name());
      sets.add(c.version()
          ? col + "=" + quote(model.tableName()) + "." + col + "+1"
          : col + "=EXCLUDED." + col);
    }
    sql.append(" DO UPDATE SET ").append(String.join(",", sets));
    String mergeWhere = compiler.compile(model, conflict.mergeWhere(), params);
    if (!mergeWhere.isBlank()) sql.append(" WHERE ").append(mergeWhere);
    return sql.toString();
  }

  private static List<ColumnMetadata> mergeColumns(ModelMetadata model, OnConflict conflict) {
    List<ColumnMetadata> out = new ArrayList<>();
    if (conflict.merge() == null) {
      for (ColumnMetadata c : model.columns()) {
        if (!c.isCollection() && !c.primary() && !c.createDate()) out.add(c);
      }
    } else {
      for (String property : conflict.merge()) out.add(ModelColumns.require(model, property));
    }
    return out;
  }

  /** Value for an absent property; {@code value} may be null when a declared default yields null. */
  private record Fallback(boolean present, Object value) {}

  private static Fallback fallback(ColumnMetadata c, OffsetDateTime now) {
    if (c.hasDefault()) return new Fallback(true, c.defaultsTo().get());
    if (c.createDate() || c.updateDate()) return new Fallback(true, now);
    if (c.version()) return new Fallback(true, 1);
    return new Fallback(false, null);
  }

  static void checkProperties(ModelMetadata model, Map<String, ?> row) {
    for (String property : row.keySet()) {
      if (model.column(property) == null) {
        throw new SchemaResolutionException("Unable to find property \"" + property + "\" on model \"" + model.name()
            + "\"", model.name(), property);
      }
    }
  }
}
