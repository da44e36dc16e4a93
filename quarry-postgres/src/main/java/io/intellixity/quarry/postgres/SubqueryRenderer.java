package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.Aggregate;
import io.intellixity.quarry.query.ScalarSubquery;
import io.intellixity.quarry.query.StructuralException;
import io.intellixity.quarry.query.Subquery;
import io.intellixity.quarry.schema.ModelMetadata;

import java.math.BigDecimal;
import java.util.*;

import static io.intellixity.quarry.postgres.PgIdentifiers.quote;

/**
 * Renders nested SELECTs (without the surrounding parentheses).\n
 *
 * Clause order: projection, FROM, WHERE, GROUP BY, HAVING, ORDER BY, LIMIT. Parameters go to the enclosing
 * statement's accumulator.\n
 */
final class SubqueryRenderer {
  private static final Map<String, String> HAVING_OPERATORS = Map.of(
      "<", "<", "<=", "<=", ">", ">", ">=", ">=", "!=", "<>");

  private final PredicateCompiler compiler;

  SubqueryRenderer(PredicateCompiler compiler) {
    this.compiler = compiler;
  }

  /** Right-hand side of {@code IN}: exactly one output column. */
  String renderInList(Subquery sq, ParamAccumulator params) {
    if (sq.projectionSize() != 1) {
      throw new StructuralException("Subquery used with \"in\" must select exactly one column; " + sq.model().name()
          + " selects " + sq.projectionSize(), sq.model().name(), null);
    }
    return render(sq, projection(sq), params);
  }

  String renderExists(Subquery sq, ParamAccumulator params) {
    String projection = sq.projectionSize() == 0 ? "1" : projection(sq);
    return render(sq, projection, params);
  }

  /** Single aggregate value, e.g. {@code SELECT AVG("price") FROM ...}. */
  String renderScalar(ScalarSubquery scalar, ParamAccumulator params) {
    Subquery sq = scalar.subquery();
    if (sq.projectionSize() != 0) {
      throw new StructuralException("Scalar subquery on " + sq.model().name() + " must select exactly one aggregate",
          sq.model().name(), null);
    }
    return render(sq, aggregateExpression(sq.model(), scalar.aggregate()), params);
  }

  /** Derived table for a subquery join; at least one output column. */
  String renderDerived(Subquery sq, ParamAccumulator params) {
    if (sq.projectionSize() == 0) {
      throw new StructuralException("Subquery join on " + sq.model().name() + " must select at least one column",
          sq.model().name(), null);
    }
    return render(sq, projection(sq), params);
  }

  private String render(Subquery sq, String projection, ParamAccumulator params) {
    ModelMetadata model = sq.model();
    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(Ordering.distinctOn(sq.distinctOn(), sq.sort(), p -> columnSql(model, p), model.name()));
    sql.append(projection).append(" FROM ").append(PgIdentifiers.table(model));

    String where = compiler.compile(model, sq.where(), params);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);

    if (!sq.groupBy().isEmpty()) {
      List<String> cols = new ArrayList<>();
      for (String p : sq.groupBy()) cols.add(columnSql(model, p));
      sql.append(" GROUP BY ").append(String.join(",", cols));
    }

    String having = having(sq);
    if (!having.isEmpty()) sql.append(" HAVING ").append(having);

    sql.append(Ordering.orderBy(sq.sort(), p -> columnSql(model, p)));
    if (sq.limit() != null) sql.append(" LIMIT ").append(sq.limit());
    return sql.toString();
  }

  private static String projection(Subquery sq) {
    List<String> items = new ArrayList<>();
    for (String p : sq.select()) items.add(ModelColumns.projection(ModelColumns.require(sq.model(), p)));
    for (Aggregate a : sq.aggregates()) {
      items.add(aggregateExpression(sq.model(), a) + " AS " + quote(PgIdentifiers.requireValid(a.alias(), "aggregate alias")));
    }
    return String.join(",", items);
  }

  private static String aggregateExpression(ModelMetadata model, Aggregate a) {
    String arg = a.property() == null ? "*" : columnSql(model, a.property());
    if (a.distinct()) arg = "DISTINCT " + arg;
    return a.function().name() + "(" + arg + ")";
  }

  private String having(Subquery sq) {
    if (sq.having() == null || sq.having().isEmpty()) return "";
    Map<String, Aggregate> byAlias = new LinkedHashMap<>();
    for (Aggregate a : sq.aggregates()) byAlias.put(a.alias(), a);

    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, ?> e : sq.having().entrySet()) {
      Aggregate agg = byAlias.get(e.getKey());
      if (agg == null) {
        throw new StructuralException("HAVING references unknown alias \"" + e.getKey() + "\" on " + sq.model().name(),
            sq.model().name(), e.getKey());
      }
      String expr = aggregateExpression(sq.model(), agg);
      if (e.getValue() instanceof Map<?, ?> ops) {
        for (Map.Entry<?, ?> op : ops.entrySet()) {
          String token = HAVING_OPERATORS.get(String.valueOf(op.getKey()));
          if (token == null) {
            throw new StructuralException("Invalid HAVING operator \"" + op.getKey() + "\" for \"" + e.getKey() + "\"",
                sq.model().name(), e.getKey());
          }
          parts.add(expr + token + number(op.getValue(), e.getKey(), sq));
        }
      } else {
        parts.add(expr + "=" + number(e.getValue(), e.getKey(), sq));
      }
    }
    return String.join(" AND ", parts);
  }

  private static String number(Object value, String alias, Subquery sq) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return value.toString();
    }
    if (value instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
    if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
      return BigDecimal.valueOf(n.doubleValue()).stripTrailingZeros().toPlainString();
    }
    throw new StructuralException("HAVING value for \"" + alias + "\" must be a finite number: " + value,
        sq.model().name(), alias);
  }

  private static String columnSql(ModelMetadata model, String property) {
    return quote(ModelColumns.require(model, property).name());
  }
}
