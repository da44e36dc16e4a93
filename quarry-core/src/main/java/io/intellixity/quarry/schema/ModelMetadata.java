package io.intellixity.quarry.schema;

import java.util.*;

/**
 * Immutable table-level metadata: qualified table name, ordered columns and the derived lookups
 * (property map, primary key, create/update timestamp and version columns).
 */
public final class ModelMetadata {
  private final String name;
  private final String schema;
  private final String tableName;
  private final List<ColumnMetadata> columns;
  private final Map<String, ColumnMetadata> columnsByPropertyName;
  private final ColumnMetadata primaryKeyColumn;
  private final List<ColumnMetadata> createDateColumns;
  private final List<ColumnMetadata> updateDateColumns;
  private final List<ColumnMetadata> versionColumns;

  public ModelMetadata(String name, String schema, String tableName, List<ColumnMetadata> columns) {
    this.name = Objects.requireNonNull(name, "name");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.tableName = (tableName == null || tableName.isBlank()) ? name.toLowerCase(Locale.ROOT) : tableName;
    this.columns = List.copyOf(columns == null ? List.of() : columns);

    Map<String, ColumnMetadata> byProperty = new LinkedHashMap<>();
    ColumnMetadata pk = null;
    List<ColumnMetadata> created = new ArrayList<>();
    List<ColumnMetadata> updated = new ArrayList<>();
    List<ColumnMetadata> versions = new ArrayList<>();
    for (ColumnMetadata c : this.columns) {
      if (byProperty.put(c.propertyName(), c) != null) {
        throw new IllegalArgumentException("Duplicate property '" + c.propertyName() + "' on model: " + name);
      }
      if (c.primary()) {
        if (pk != null) throw new IllegalArgumentException("Model has more than one primary column: " + name);
        pk = c;
      }
      if (c.createDate()) created.add(c);
      if (c.updateDate()) updated.add(c);
      if (c.version()) versions.add(c);
    }
    this.columnsByPropertyName = Collections.unmodifiableMap(byProperty);
    this.primaryKeyColumn = pk;
    this.createDateColumns = List.copyOf(created);
    this.updateDateColumns = List.copyOf(updated);
    this.versionColumns = List.copyOf(versions);
  }

  public ModelMetadata(String name, String tableName, List<ColumnMetadata> columns) {
    this(name, null, tableName, columns);
  }

  public String name() { return name; }
  /** Database schema, or null for the connection's search path. */
  public String schema() { return schema; }
  public String tableName() { return tableName; }
  public List<ColumnMetadata> columns() { return columns; }
  public Map<String, ColumnMetadata> columnsByPropertyName() { return columnsByPropertyName; }
  /** Primary key column, or null when the model declares none. */
  public ColumnMetadata primaryKeyColumn() { return primaryKeyColumn; }
  public List<ColumnMetadata> createDateColumns() { return createDateColumns; }
  public List<ColumnMetadata> updateDateColumns() { return updateDateColumns; }
  public List<ColumnMetadata> versionColumns() { return versionColumns; }

  /** Column for a property, or null if the model has no such property. */
  public ColumnMetadata column(String propertyName) {
    return propertyName == null ? null : columnsByPropertyName.get(propertyName);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return "ModelMetadata[" + name + " -> " + (schema == null ? "" : schema + ".") + tableName + "]";
  }

  public static final class Builder {
    private final String name;
    private String schema;
    private String tableName;
    private final List<ColumnMetadata> columns = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder schema(String schema) { this.schema = schema; return this; }
    public Builder table(String tableName) { this.tableName = tableName; return this; }
    public Builder column(ColumnMetadata column) { this.columns.add(column); return this; }
    public Builder column(ColumnMetadata.Builder column) { this.columns.add(column.build()); return this; }

    public ModelMetadata build() {
      return new ModelMetadata(name, schema, tableName, columns);
    }
  }
}
