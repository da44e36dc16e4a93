package io.intellixity.quarry.schema;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable descriptor of one model property and its physical column.
 *
 * <p>A column is one of three shapes:
 * <ul>
 *   <li>typed: {@code type} is set (string, integer, float, boolean, date, datetime, uuid, json, array, string[] ...)</li>
 *   <li>relationship: {@code relatedModel} names the model whose primary key this column stores</li>
 *   <li>collection: {@code collection} names the child model; there is no physical column</li>
 * </ul>
 */
public record ColumnMetadata(
    String name,
    String propertyName,
    String type,
    boolean required,
    Integer maxLength,
    /** Literal or factory default; null when the column has no default. */
    Supplier<?> defaultsTo,
    boolean primary,
    boolean createDate,
    boolean updateDate,
    boolean version,
    String relatedModel,
    String collection,
    String via
) {
  public ColumnMetadata {
    Objects.requireNonNull(propertyName, "propertyName");
    if (propertyName.isBlank()) throw new IllegalArgumentException("propertyName must not be blank");
    if (name == null || name.isBlank()) name = propertyName;
    if (maxLength != null && maxLength < 0) {
      throw new IllegalArgumentException("maxLength must be >= 0 for property: " + propertyName);
    }
    if (relatedModel != null && collection != null) {
      throw new IllegalArgumentException("Column cannot be both a relationship and a collection: " + propertyName);
    }
  }

  public boolean isRelationship() { return relatedModel != null; }
  public boolean isCollection() { return collection != null; }
  public boolean hasDefault() { return defaultsTo != null; }

  /** Lower-cased declared type, or empty for relationship/collection columns. */
  public String typeLowered() {
    return type == null ? "" : type.toLowerCase(Locale.ROOT);
  }

  /** Postgres array column: {@code array} or any {@code T[]}. */
  public boolean isArrayType() {
    String t = typeLowered();
    return t.equals("array") || t.endsWith("[]");
  }

  /** Array column whose elements are text; like-matching unnests these. */
  public boolean isStringArrayType() {
    String t = typeLowered();
    return t.equals("array") || t.equals("string[]");
  }

  public boolean isJson() {
    String t = typeLowered();
    return t.equals("json") || t.equals("jsonb");
  }

  /** Types whose values are subject to maxLength checks. */
  public boolean isStringLike() {
    String t = typeLowered();
    return t.equals("string") || t.equals("string[]");
  }

  public static Builder builder(String propertyName) {
    return new Builder(propertyName);
  }

  public static final class Builder {
    private final String propertyName;
    private String name;
    private String type;
    private boolean required;
    private Integer maxLength;
    private Supplier<?> defaultsTo;
    private boolean primary;
    private boolean createDate;
    private boolean updateDate;
    private boolean version;
    private String relatedModel;
    private String collection;
    private String via;

    private Builder(String propertyName) {
      this.propertyName = propertyName;
    }

    public Builder column(String name) { this.name = name; return this; }
    public Builder type(String type) { this.type = type; return this; }
    public Builder required() { this.required = true; return this; }
    public Builder required(boolean required) { this.required = required; return this; }
    public Builder maxLength(Integer maxLength) { this.maxLength = maxLength; return this; }
    public Builder primary() { this.primary = true; return this; }
    public Builder createDate() { this.createDate = true; return this; }
    public Builder updateDate() { this.updateDate = true; return this; }
    public Builder version() { this.version = true; return this; }
    public Builder model(String relatedModel) { this.relatedModel = relatedModel; return this; }

    public Builder collection(String childModel, String via) {
      this.collection = childModel;
      this.via = via;
      return this;
    }

    /** Literal default; the same value is used for every insert. */
    public Builder defaultsTo(Object literal) {
      this.defaultsTo = () -> literal;
      return this;
    }

    /** Factory default; invoked once per insert statement. */
    public Builder defaultsTo(Supplier<?> factory) {
      this.defaultsTo = factory;
      return this;
    }

    public ColumnMetadata build() {
      return new ColumnMetadata(name, propertyName, type, required, maxLength, defaultsTo,
          primary, createDate, updateDate, version, relatedModel, collection, via);
    }
  }
}
