package io.intellixity.quarry.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quarry.query.TypeConstraintException;

/** Serializes values bound to {@code ::jsonb} placeholders. */
public final class JsonParams {
  private static final ObjectMapper JSON = new ObjectMapper();

  private JsonParams() {}

  public static String write(Object value, String model, String property) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new TypeConstraintException("Unable to serialize json value for \"" + property + "\" on \"" + model + "\": "
          + e.getOriginalMessage(), model, property);
    }
  }
}
