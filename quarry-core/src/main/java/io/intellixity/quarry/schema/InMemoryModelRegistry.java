package io.intellixity.quarry.schema;

import java.util.*;

/**
 * Simple in-memory {@link ModelRegistry}.\n
 *
 * Model names are matched case-insensitively. The registry is populated once in the constructor and never
 * mutated afterwards.\n
 */
public final class InMemoryModelRegistry implements ModelRegistry {
  private final Map<String, ModelMetadata> models;

  public InMemoryModelRegistry(Collection<ModelMetadata> models) {
    Map<String, ModelMetadata> byName = new LinkedHashMap<>();
    for (ModelMetadata m : models) {
      String key = key(m.name());
      if (byName.put(key, m) != null) throw new IllegalArgumentException("Duplicate model: " + m.name());
    }
    this.models = Collections.unmodifiableMap(byName);
  }

  public static InMemoryModelRegistry of(ModelMetadata... models) {
    return new InMemoryModelRegistry(List.of(models));
  }

  @Override
  public Optional<ModelMetadata> find(String modelName) {
    if (modelName == null) return Optional.empty();
    return Optional.ofNullable(models.get(key(modelName)));
  }

  @Override
  public Collection<ModelMetadata> models() { return models.values(); }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
