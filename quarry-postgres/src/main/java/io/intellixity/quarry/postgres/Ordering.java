package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.SortField;
import io.intellixity.quarry.query.StructuralException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** ORDER BY and DISTINCT ON rendering shared by selects and subqueries. */
public final class Ordering {
  private Ordering() {}

  /** {@code " ORDER BY a,b DESC"}, or empty when there is no sort. */
  public static String orderBy(List<SortField> sort, Function<String, String> columnSql) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(columnSql.apply(sf.property()) + (sf.descending() ? " DESC" : ""));
    }
    return " ORDER BY " + String.join(",", parts);
  }

  /**
   * {@code "DISTINCT ON (a,b) "}, or empty when {@code distinctOn} is empty. The distinct expressions must be the
   * leftmost sort expressions, in order.
   */
  public static String distinctOn(List<String> distinctOn, List<SortField> sort, Function<String, String> columnSql,
                                  String model) {
    if (distinctOn == null || distinctOn.isEmpty()) return "";
    if (sort == null || sort.isEmpty()) {
      throw new StructuralException("DISTINCT ON requires ORDER BY (model " + model + ")", model, null);
    }
    List<String> exprs = new ArrayList<>();
    for (String property : distinctOn) exprs.add(columnSql.apply(property));
    if (sort.size() < exprs.size()) throw mismatch(model);
    for (int i = 0; i < exprs.size(); i++) {
      if (!exprs.get(i).equals(columnSql.apply(sort.get(i).property()))) throw mismatch(model);
    }
    return "DISTINCT ON (" + String.join(",", exprs) + ") ";
  }

  private static StructuralException mismatch(String model) {
    return new StructuralException("DISTINCT ON columns must match the leftmost ORDER BY columns (model " + model + ")",
        model, null);
  }
}
