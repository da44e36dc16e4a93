package io.intellixity.quarry.jdbc;

/** A statement failed in the database or the driver. */
public final class QueryExecutionException extends RuntimeException {
  private final String operation;
  private final String model;

  public QueryExecutionException(String operation, String model, Throwable cause) {
    super("quarry " + operation + " on " + model + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.operation = operation;
    this.model = model;
  }

  public String operation() { return operation; }
  public String model() { return model; }
}
