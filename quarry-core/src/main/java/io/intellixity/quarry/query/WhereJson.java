package io.intellixity.quarry.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/** Reads where expressions from JSON, e.g. a request body or a stored filter. */
public final class WhereJson {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  private WhereJson() {}

  public static Map<String, Object> parse(String json) {
    if (json == null || json.isBlank()) return null;
    JsonNode root;
    try {
      root = JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new QueryArgumentException("Where JSON is not valid: " + e.getOriginalMessage());
    }
    return parse(root);
  }

  public static Map<String, Object> parse(JsonNode root) {
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryArgumentException("Where JSON must be an object");
    return JSON.convertValue(root, MAP);
  }
}
