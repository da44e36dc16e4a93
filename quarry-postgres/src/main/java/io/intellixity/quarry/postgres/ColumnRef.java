package io.intellixity.quarry.postgres;

import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;

/**
 * A resolved column reference.\n
 *
 * {@code metadata} and {@code owner} are null for columns of a derived (subquery) join, whose types are unknown.
 * {@code qualifier} is null for unqualified references to the statement's root table.\n
 */
record ColumnRef(String qualifier, String name, String propertyName, ColumnMetadata metadata, ModelMetadata owner) {
  static ColumnRef local(ModelMetadata owner, ColumnMetadata column, String qualifier) {
    return new ColumnRef(qualifier, column.name(), column.propertyName(), column, owner);
  }

  static ColumnRef derived(String alias, String column) {
    return new ColumnRef(alias, column, column, null, null);
  }

  String sql() {
    return PgIdentifiers.qualified(qualifier, name);
  }

  boolean isArrayType() { return metadata != null && metadata.isArrayType(); }
  boolean isStringArrayType() { return metadata != null && metadata.isStringArrayType(); }
  boolean isJson() { return metadata != null && metadata.isJson(); }

  /** Declared type for error messages. */
  String typeName() {
    return metadata == null || metadata.type() == null ? "unknown" : metadata.typeLowered();
  }

  String modelName() {
    return owner == null ? qualifier : owner.name();
  }
}
