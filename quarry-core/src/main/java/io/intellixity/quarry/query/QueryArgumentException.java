package io.intellixity.quarry.query;

/** Invalid builder argument, e.g. a non-numeric limit or skip. */
public final class QueryArgumentException extends QueryBuildException {
  public QueryArgumentException(String message) {
    super(message);
  }

  public QueryArgumentException(String message, String model, String property) {
    super(message, model, property);
  }
}
