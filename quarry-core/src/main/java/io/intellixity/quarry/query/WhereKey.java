package io.intellixity.quarry.query;

import java.util.*;

/**
 * Closed set of keys a where-expression mapping may contain.
 * <p>
 * Any key that is not one of the reserved tokens is a property name ({@link #PROPERTY}).
 */
public enum WhereKey {
  NOT("not", "!"),
  OR("or"),
  AND("and"),

  CONTAINS("contains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  LIKE("like"),

  LESS_THAN("<"),
  LESS_THAN_OR_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_THAN_OR_EQUAL(">="),

  IN("in"),
  EXISTS("exists"),

  PROPERTY();

  private static final Map<String, WhereKey> BY_TOKEN;

  static {
    Map<String, WhereKey> m = new HashMap<>();
    for (WhereKey k : values()) {
      for (String t : k.tokens) m.put(t, k);
    }
    BY_TOKEN = Collections.unmodifiableMap(m);
  }

  private final List<String> tokens;

  WhereKey(String... tokens) {
    this.tokens = List.of(tokens);
  }

  /** Canonical spelling, or null for {@link #PROPERTY}. */
  public String token() {
    return tokens.isEmpty() ? null : tokens.get(0);
  }

  public static WhereKey classify(String key) {
    if (key == null) return PROPERTY;
    return BY_TOKEN.getOrDefault(key, PROPERTY);
  }

  public boolean isOrdering() {
    return this == LESS_THAN || this == LESS_THAN_OR_EQUAL || this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
  }
}
