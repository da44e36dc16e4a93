package io.intellixity.quarry.query;

import java.util.*;

/**
 * Static helpers for building where expressions in code.
 * <p>
 * Unlike {@link Map#of}, every helper accepts null values, which compile to {@code IS NULL}.
 */
public final class Where {
  private Where() {}

  public static Map<String, Object> of(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(key, value);
    return m;
  }

  public static Map<String, Object> of(String k1, Object v1, String k2, Object v2) {
    Map<String, Object> m = of(k1, v1);
    m.put(k2, v2);
    return m;
  }

  public static Map<String, Object> of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
    Map<String, Object> m = of(k1, v1, k2, v2);
    m.put(k3, v3);
    return m;
  }

  public static Map<String, Object> not(Object expression) { return of(WhereKey.NOT.token(), expression); }

  public static Map<String, Object> or(Object... branches) { return of(WhereKey.OR.token(), Arrays.asList(branches)); }
  public static Map<String, Object> and(Object... branches) { return of(WhereKey.AND.token(), Arrays.asList(branches)); }

  public static Map<String, Object> like(Object value) { return of(WhereKey.LIKE.token(), value); }
  public static Map<String, Object> contains(Object value) { return of(WhereKey.CONTAINS.token(), value); }
  public static Map<String, Object> startsWith(Object value) { return of(WhereKey.STARTS_WITH.token(), value); }
  public static Map<String, Object> endsWith(Object value) { return of(WhereKey.ENDS_WITH.token(), value); }

  public static Map<String, Object> lt(Object value) { return of(WhereKey.LESS_THAN.token(), value); }
  public static Map<String, Object> lte(Object value) { return of(WhereKey.LESS_THAN_OR_EQUAL.token(), value); }
  public static Map<String, Object> gt(Object value) { return of(WhereKey.GREATER_THAN.token(), value); }
  public static Map<String, Object> gte(Object value) { return of(WhereKey.GREATER_THAN_OR_EQUAL.token(), value); }

  public static Map<String, Object> in(Subquery subquery) { return of(WhereKey.IN.token(), subquery); }
  public static Map<String, Object> exists(Subquery subquery) { return of(WhereKey.EXISTS.token(), subquery); }

  /** Null-tolerant list of values, e.g. {@code anyOf(null, "", "a")}. */
  public static List<Object> anyOf(Object... values) {
    return Arrays.asList(values);
  }
}
