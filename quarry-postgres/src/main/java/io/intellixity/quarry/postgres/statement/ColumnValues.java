package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.JsonParams;
import io.intellixity.quarry.postgres.ParamAccumulator;
import io.intellixity.quarry.query.ForeignKeyRef;
import io.intellixity.quarry.query.TypeConstraintException;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;
import io.intellixity.quarry.schema.ModelRegistry;

import java.util.Collection;
import java.util.Map;

/** Value-to-SQL rules shared by INSERT and UPDATE. */
final class ColumnValues {
  private ColumnValues() {}

  /**
   * Literal {@code NULL}, a placeholder, or a {@code ::jsonb} placeholder. Hydrated relationship records are reduced
   * to their primary key.
   */
  static String placeholder(ModelRegistry registry, ModelMetadata model, ColumnMetadata column, Object value,
                            ParamAccumulator params) {
    if (value == null) return "NULL";
    if (column.isRelationship() && value instanceof Map<?, ?>) {
      ColumnMetadata pk = registry.relatedPrimaryKey(model, column);
      Object id = ForeignKeyRef.resolve(value, pk.propertyName())
          .map(ForeignKeyRef::id)
          .orElseThrow(() -> new TypeConstraintException("Undefined primary key value for hydrated object value for \""
              + column.propertyName() + "\" on \"" + model.name() + "\"", model.name(), column.propertyName()));
      return params.add(id);
    }
    if (column.isJson() && (value instanceof Collection<?> || value instanceof Object[])) {
      return params.add(JsonParams.write(value, model.name(), column.propertyName())) + "::jsonb";
    }
    return params.add(value);
  }

  /** Rejects string (and string array) values longer than the column's maxLength. */
  static void checkMaxLength(ModelMetadata model, Map<String, ?> row, String verb) {
    for (ColumnMetadata c : model.columns()) {
      if (c.maxLength() == null || !c.isStringLike() || !row.containsKey(c.propertyName())) continue;
      Object v = row.get(c.propertyName());
      boolean tooLong = false;
      if (v instanceof String s) {
        tooLong = s.length() > c.maxLength();
      } else if (v instanceof Collection<?> items) {
        for (Object item : items) {
          if (item instanceof String s && s.length() > c.maxLength()) tooLong = true;
        }
      } else if (v instanceof Object[] items) {
        for (Object item : items) {
          if (item instanceof String s && s.length() > c.maxLength()) tooLong = true;
        }
      }
      if (tooLong) {
        throw new TypeConstraintException(verb + " statement for \"" + model.name()
            + "\" contains a value that exceeds maxLength on field: " + c.propertyName(), model.name(), c.propertyName());
      }
    }
  }
}
