package io.intellixity.quarry.query;

import java.util.Locale;
import java.util.Objects;

/**
 * Aggregate select expression, e.g. {@code COUNT(*) AS "count"} or {@code SUM("price") AS "total"}.
 * <p>
 * The alias defaults to the lower-cased function name.
 */
public record Aggregate(Function function, String property, boolean distinct, String alias) {
  public enum Function { COUNT, SUM, AVG, MAX, MIN }

  public Aggregate {
    Objects.requireNonNull(function, "function");
    if (function != Function.COUNT && property == null) {
      throw new IllegalArgumentException(function + " requires a property");
    }
    if (distinct && property == null) throw new IllegalArgumentException("DISTINCT requires a property");
    if (alias == null || alias.isBlank()) alias = function.name().toLowerCase(Locale.ROOT);
  }

  public static Aggregate count() { return new Aggregate(Function.COUNT, null, false, null); }
  public static Aggregate count(String property) { return new Aggregate(Function.COUNT, property, false, null); }
  public static Aggregate countDistinct(String property) { return new Aggregate(Function.COUNT, property, true, null); }
  public static Aggregate sum(String property) { return new Aggregate(Function.SUM, property, false, null); }
  public static Aggregate avg(String property) { return new Aggregate(Function.AVG, property, false, null); }
  public static Aggregate max(String property) { return new Aggregate(Function.MAX, property, false, null); }
  public static Aggregate min(String property) { return new Aggregate(Function.MIN, property, false, null); }

  public Aggregate as(String alias) {
    return new Aggregate(function, property, distinct, alias);
  }

  public Aggregate withDistinct() {
    return new Aggregate(function, property, true, alias);
  }
}
