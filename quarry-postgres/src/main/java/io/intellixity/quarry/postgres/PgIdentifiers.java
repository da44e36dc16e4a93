package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.StructuralException;
import io.intellixity.quarry.schema.ModelMetadata;

import java.util.regex.Pattern;

/** Identifier quoting and validation for generated SQL. */
public final class PgIdentifiers {
  private static final Pattern SAFE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private PgIdentifiers() {}

  public static String quote(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  public static String qualified(String qualifier, String column) {
    return qualifier == null ? quote(column) : quote(qualifier) + "." + quote(column);
  }

  /** {@code "schema"."table"} or {@code "table"}. */
  public static String table(ModelMetadata model) {
    return model.schema() == null ? quote(model.tableName()) : quote(model.schema()) + "." + quote(model.tableName());
  }

  /**
   * Validates caller-chosen names (join aliases, aggregate aliases, subquery columns) that are interpolated into SQL.
   */
  public static String requireValid(String ident, String role) {
    if (ident == null || !SAFE.matcher(ident).matches()) {
      throw new StructuralException("Invalid SQL identifier for " + role + ": " + ident);
    }
    return ident;
  }
}
