package io.intellixity.quarry.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads model metadata from a JSON document.
 *
 * <pre>
 * {
 *   "models": [
 *     {
 *       "name": "Product",
 *       "schema": "catalog",
 *       "table": "products",
 *       "columns": [
 *         { "property": "id", "type": "integer", "primary": true },
 *         { "property": "name", "type": "string", "required": true, "maxLength": 50 },
 *         { "property": "aliases", "column": "alias_names", "type": "string[]", "defaultsTo": [] },
 *         { "property": "store", "column": "store_id", "model": "Store", "required": true },
 *         { "property": "categories", "collection": "Category", "via": "product" }
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 */
public final class ModelDefinitions {
  private static final ObjectMapper JSON = new ObjectMapper();

  private ModelDefinitions() {}

  public static InMemoryModelRegistry registry(InputStream in) {
    return new InMemoryModelRegistry(read(in));
  }

  /** Reads a classpath resource; fails if the resource does not exist. */
  public static InMemoryModelRegistry registryFromResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ModelDefinitions.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Model definition resource not found: " + resource);
      return registry(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  public static List<ModelMetadata> read(InputStream in) {
    JsonNode root;
    try {
      root = JSON.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse model definitions", e);
    }
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Model definitions must be a JSON object");
    JsonNode models = root.get("models");
    if (models == null || !models.isArray()) throw new IllegalArgumentException("Model definitions require a 'models' array");

    List<ModelMetadata> out = new ArrayList<>();
    for (JsonNode m : models) out.add(parseModel(m));
    return out;
  }

  private static ModelMetadata parseModel(JsonNode m) {
    String name = textOrNull(m.get("name"));
    if (name == null) throw new IllegalArgumentException("Model definition is missing 'name'");
    ModelMetadata.Builder b = ModelMetadata.builder(name)
        .schema(textOrNull(m.get("schema")))
        .table(textOrNull(m.get("table")));
    JsonNode cols = m.get("columns");
    if (cols != null && cols.isArray()) {
      for (JsonNode c : cols) b.column(parseColumn(name, c));
    }
    return b.build();
  }

  private static ColumnMetadata parseColumn(String model, JsonNode c) {
    String property = textOrNull(c.get("property"));
    if (property == null) throw new IllegalArgumentException("Column definition on " + model + " is missing 'property'");
    ColumnMetadata.Builder b = ColumnMetadata.builder(property)
        .column(textOrNull(c.get("column")))
        .type(textOrNull(c.get("type")))
        .model(textOrNull(c.get("model")))
        .required(c.path("required").asBoolean(false));
    if (c.hasNonNull("maxLength")) b.maxLength(c.get("maxLength").asInt());
    if (c.path("primary").asBoolean(false)) b.primary();
    if (c.path("createDate").asBoolean(false)) b.createDate();
    if (c.path("updateDate").asBoolean(false)) b.updateDate();
    if (c.path("version").asBoolean(false)) b.version();
    String collection = textOrNull(c.get("collection"));
    if (collection != null) b.collection(collection, textOrNull(c.get("via")));
    if (c.has("defaultsTo")) {
      // Container defaults are rebuilt on every call.
      JsonNode d = c.get("defaultsTo");
      if (d.isContainerNode()) {
        b.defaultsTo(() -> JSON.convertValue(d, Object.class));
      } else {
        b.defaultsTo(JSON.convertValue(d, Object.class));
      }
    }
    return b.build();
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }
}
