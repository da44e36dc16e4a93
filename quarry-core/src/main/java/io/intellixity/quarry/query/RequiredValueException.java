package io.intellixity.quarry.query;

/** A required column has no value and no default on insert. */
public final class RequiredValueException extends QueryBuildException {
  public RequiredValueException(String message) {
    super(message);
  }

  public RequiredValueException(String message, String model, String property) {
    super(message, model, property);
  }
}
