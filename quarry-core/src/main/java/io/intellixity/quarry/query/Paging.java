package io.intellixity.quarry.query;

/**
 * Row window of a select.
 * <p>
 * {@code limit} and {@code skip} accept numbers or numeric strings; zero means "not set" and is not rendered.
 */
public record Paging(long limit, long skip) {
  public static final Paging NONE = new Paging(0, 0);

  public Paging {
    if (limit < 0) throw new QueryArgumentException("Limit should be a non-negative number");
    if (skip < 0) throw new QueryArgumentException("Skip should be a non-negative number");
  }

  public static Paging of(Object limit, Object skip) {
    return new Paging(coerce(limit, "Limit"), coerce(skip, "Skip"));
  }

  public static Paging limit(Object limit) {
    return of(limit, null);
  }

  public Paging withLimit(Object limit) {
    return new Paging(coerce(limit, "Limit"), skip);
  }

  public Paging withSkip(Object skip) {
    return new Paging(limit, coerce(skip, "Skip"));
  }

  public boolean hasLimit() { return limit > 0; }
  public boolean hasSkip() { return skip > 0; }

  static long coerce(Object value, String label) {
    if (value == null) return 0;
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number n) return finite(n.doubleValue(), label);
    if (value instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if (s.isEmpty()) return 0;
      try {
        return finite(Double.parseDouble(s), label);
      } catch (NumberFormatException e) {
        throw new QueryArgumentException(label + " should be a number");
      }
    }
    throw new QueryArgumentException(label + " should be a number");
  }

  private static long finite(double d, String label) {
    if (Double.isNaN(d) || Double.isInfinite(d)) throw new QueryArgumentException(label + " should be a number");
    return (long) d;
  }
}
