package io.intellixity.quarry.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Logs generated SQL through SLF4J.\n
 *
 * DEBUG: operation, model, parameter count and SQL text. TRACE: one line per parameter with its type and length,
 * never its value.\n
 */
public final class Slf4jSqlDiagnostics implements SqlDiagnostics {
  private static final Logger log = LoggerFactory.getLogger(Slf4jSqlDiagnostics.class);

  @Override
  public void beforeExecute(String operation, String model, String sql, List<Object> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("quarry.sql op={} model={} paramCount={} sql={}",
        operation, model, params == null ? 0 : params.size(), sql);

    if (log.isTraceEnabled() && params != null && !params.isEmpty()) {
      int idx = 1;
      for (Object v : params) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof Collection<?> c) ? c.size() : -1;
        log.trace("quarry.sql param index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  @Override
  public void afterExecute(String operation, String model, long durationNanos, Object result) {
    if (!log.isDebugEnabled()) return;
    log.debug("quarry.sql_done op={} model={} durationMs={} result={}",
        operation, model, durationNanos / 1_000_000.0, safeResult(result));
  }

  static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof Collection<?> c) return "rows=" + c.size();
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
