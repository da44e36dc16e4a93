package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.SchemaResolutionException;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;

/** Property to column lookups that fail on unknown properties. */
public final class ModelColumns {
  private ModelColumns() {}

  /** Physical column for {@code property}; collections have no column and are rejected. */
  public static ColumnMetadata require(ModelMetadata model, String property) {
    ColumnMetadata column = model.column(property);
    if (column == null || column.isCollection()) {
      throw new SchemaResolutionException("Unable to find property \"" + property + "\" on model \"" + model.name() + "\"",
          model.name(), property);
    }
    return column;
  }

  /** {@code "column"} or {@code "column" AS "property"} when they differ. */
  public static String projection(ColumnMetadata column) {
    String sql = PgIdentifiers.quote(column.name());
    return column.name().equals(column.propertyName()) ? sql : sql + " AS " + PgIdentifiers.quote(column.propertyName());
  }
}
