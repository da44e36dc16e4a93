package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.TypeConstraintException;
import io.intellixity.quarry.query.WhereKey;

/**
 * Renders one column compared against one value.\n
 *
 * Ordering comparers ({@code < <= > >=}) invert under negation; array columns compared to a scalar use
 * {@code =ANY} / {@code <>ALL}. Null values always render as {@code IS [NOT] NULL}.\n
 */
final class ComparisonBuilder {

  String build(ColumnRef column, WhereKey comparer, boolean negated, Object value, ParamAccumulator params) {
    if (value == null) return column.sql() + (negated ? " IS NOT NULL" : " IS NULL");

    if (comparer != null && comparer.isOrdering()) {
      rejectOrderingOn(column, comparer);
      return column.sql() + ordering(comparer, negated) + params.add(value);
    }

    if (column.isArrayType()) {
      String p = params.add(value);
      return negated ? p + "<>ALL(" + column.sql() + ")" : p + "=ANY(" + column.sql() + ")";
    }
    return column.sql() + (negated ? "<>" : "=") + params.add(value);
  }

  /** Comparison against already-rendered SQL, e.g. a parenthesized scalar subquery. */
  String buildAgainst(ColumnRef column, WhereKey comparer, boolean negated, String rhsSql) {
    if (comparer != null && comparer.isOrdering()) {
      rejectOrderingOn(column, comparer);
      return column.sql() + ordering(comparer, negated) + rhsSql;
    }
    return column.sql() + (negated ? "<>" : "=") + rhsSql;
  }

  static String ordering(WhereKey comparer, boolean negated) {
    return switch (comparer) {
      case LESS_THAN -> negated ? ">=" : "<";
      case LESS_THAN_OR_EQUAL -> negated ? ">" : "<=";
      case GREATER_THAN -> negated ? "<=" : ">";
      case GREATER_THAN_OR_EQUAL -> negated ? "<" : ">=";
      default -> throw new IllegalArgumentException("Not an ordering comparer: " + comparer);
    };
  }

  private static void rejectOrderingOn(ColumnRef column, WhereKey comparer) {
    if (column.isArrayType() || column.isJson()) {
      String kind = column.isJson() ? "json" : "array";
      throw new TypeConstraintException(comparer.token() + " operator is not supported for " + kind
          + " type. " + column.propertyName() + " on " + column.modelName(), column.modelName(), column.propertyName());
    }
  }
}
