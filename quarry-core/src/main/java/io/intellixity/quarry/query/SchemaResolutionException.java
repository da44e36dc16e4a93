package io.intellixity.quarry.query;

/** Unknown property, model, relationship or join alias. */
public final class SchemaResolutionException extends QueryBuildException {
  public SchemaResolutionException(String message) {
    super(message);
  }

  public SchemaResolutionException(String message, String model, String property) {
    super(message, model, property);
  }
}
