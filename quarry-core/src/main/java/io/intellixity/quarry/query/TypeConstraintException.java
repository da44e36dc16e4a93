package io.intellixity.quarry.query;

/** Value of the wrong type for an operator, an operator unsupported for a column type, or a maxLength violation. */
public final class TypeConstraintException extends QueryBuildException {
  public TypeConstraintException(String message) {
    super(message);
  }

  public TypeConstraintException(String message, String model, String property) {
    super(message, model, property);
  }
}
