package io.intellixity.quarry.query;

/** Malformed where expression, subquery or join. */
public final class StructuralException extends QueryBuildException {
  public StructuralException(String message) {
    super(message);
  }

  public StructuralException(String message, String model, String property) {
    super(message, model, property);
  }
}
