package io.intellixity.quarry.query;

import java.util.Map;
import java.util.Optional;

/**
 * Value supplied for a relationship (or primary key) property: either the key itself or a hydrated record
 * carrying it.
 */
public sealed interface ForeignKeyRef permits ForeignKeyRef.Scalar, ForeignKeyRef.HydratedEntity {
  Object id();

  record Scalar(Object id) implements ForeignKeyRef {}

  record HydratedEntity(Map<?, ?> record, Object id) implements ForeignKeyRef {}

  /**
   * Classifies {@code value} against the referenced model's primary key property.
   * <p>
   * Non-map values are scalar keys. A map whose primary key property is populated is a hydrated entity. Any other
   * map is not a key reference (for filters it is a nested where expression), and the result is empty.
   */
  static Optional<ForeignKeyRef> resolve(Object value, String primaryKeyProperty) {
    if (value instanceof Map<?, ?> m) {
      Object id = primaryKeyProperty == null ? null : m.get(primaryKeyProperty);
      if (id == null) return Optional.empty();
      return Optional.of(new HydratedEntity(m, id));
    }
    return Optional.of(new Scalar(value));
  }
}
