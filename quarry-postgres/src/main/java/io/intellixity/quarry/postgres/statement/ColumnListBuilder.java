package io.intellixity.quarry.postgres.statement;

import io.intellixity.quarry.postgres.ModelColumns;
import io.intellixity.quarry.query.StructuralException;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Projection lists for SELECT and RETURNING. */
public final class ColumnListBuilder {
  private ColumnListBuilder() {}

  /**
   * {@code select == null}: every non-collection column in declaration order. Otherwise the listed properties, plus
   * the primary key when it is not already listed. Repeated properties are projected once.
   */
  public static String columns(ModelMetadata model, List<String> select) {
    List<String> items = new ArrayList<>();
    if (select == null) {
      for (ColumnMetadata c : model.columns()) {
        if (!c.isCollection()) items.add(ModelColumns.projection(c));
      }
    } else {
      ColumnMetadata pk = model.primaryKeyColumn();
      Set<ColumnMetadata> seen = new LinkedHashSet<>();
      for (String property : select) {
        seen.add(ModelColumns.require(model, property));
      }
      if (pk != null) seen.add(pk);
      for (ColumnMetadata c : seen) items.add(ModelColumns.projection(c));
    }
    if (items.isEmpty()) {
      throw new StructuralException("No columns to select for model " + model.name(), model.name(), null);
    }
    return String.join(",", items);
  }
}
