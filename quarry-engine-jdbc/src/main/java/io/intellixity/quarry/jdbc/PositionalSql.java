package io.intellixity.quarry.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites Postgres positional placeholders ({@code $1, $2, ...}) into JDBC {@code ?} binds.\n
 *
 * Rules:\n
 * - {@code $} followed by digits is a placeholder; the bind list follows appearance order, so a reused number
 *   binds its value again.\n
 * - Placeholders inside single-quoted literals and double-quoted identifiers are left alone.\n
 * - Casts ({@code $1::jsonb}) keep their {@code ::type} suffix.\n
 */
public final class PositionalSql {
  private PositionalSql() {}

  public record Compiled(String sql, List<Object> binds) {
    public Compiled {
      binds = Collections.unmodifiableList(new ArrayList<>(binds));
    }
  }

  public static Compiled compile(String sql, List<Object> params) {
    if (sql == null) return new Compiled("", List.of());
    List<Object> values = params == null ? List.of() : params;
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> binds = new ArrayList<>();
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == '$' && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n < 1 || n > values.size()) {
          throw new IllegalArgumentException("Missing parameter $" + n + " (" + values.size() + " supplied)");
        }
        binds.add(values.get(n - 1));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }
    return new Compiled(out.toString(), binds);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
