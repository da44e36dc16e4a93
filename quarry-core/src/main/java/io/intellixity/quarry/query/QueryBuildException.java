package io.intellixity.quarry.query;

/**
 * Raised when a statement cannot be built from the given model, filter or values.
 * <p>
 * Carries the model and (when known) the property the failure was detected on. Subtypes narrow the cause;
 * callers that only need "the build was rejected" can catch this type.
 */
public class QueryBuildException extends RuntimeException {
  private final String model;
  private final String property;

  public QueryBuildException(String message) {
    this(message, null, null);
  }

  public QueryBuildException(String message, String model, String property) {
    super(message);
    this.model = model;
    this.property = property;
  }

  public QueryBuildException(String message, String model, String property, Throwable cause) {
    super(message, cause);
    this.model = model;
    this.property = property;
  }

  /** Model name, or null when the failure is not tied to a model. */
  public String model() { return model; }

  /** Property name, or null when the failure is not tied to a property. */
  public String property() { return property; }
}
