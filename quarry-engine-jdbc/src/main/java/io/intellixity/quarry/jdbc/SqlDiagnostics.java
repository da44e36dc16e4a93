package io.intellixity.quarry.jdbc;

import java.util.List;

/** Hook invoked around every statement a repository executes. */
public interface SqlDiagnostics {
  void beforeExecute(String operation, String model, String sql, List<Object> params);

  void afterExecute(String operation, String model, long durationNanos, Object result);

  static SqlDiagnostics none() {
    return NoSqlDiagnostics.INSTANCE;
  }

  enum NoSqlDiagnostics implements SqlDiagnostics {
    INSTANCE;

    @Override public void beforeExecute(String operation, String model, String sql, List<Object> params) {}
    @Override public void afterExecute(String operation, String model, long durationNanos, Object result) {}
  }
}
