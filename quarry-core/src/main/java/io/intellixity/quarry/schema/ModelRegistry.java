package io.intellixity.quarry.schema;

import io.intellixity.quarry.query.SchemaResolutionException;

import java.util.Collection;
import java.util.Optional;

/** Read-only lookup of registered models. Implementations must be safe for concurrent reads. */
public interface ModelRegistry {
  Optional<ModelMetadata> find(String modelName);

  Collection<ModelMetadata> models();

  default ModelMetadata model(String modelName) {
    return find(modelName).orElseThrow(() ->
        new SchemaResolutionException("Unable to find model schema (" + modelName + ")", modelName, null));
  }

  /** Model referenced by a relationship column of {@code owner}. */
  default ModelMetadata relatedModel(ModelMetadata owner, ColumnMetadata column) {
    if (!column.isRelationship()) {
      throw new SchemaResolutionException("\"" + column.propertyName() + "\" on \"" + owner.name() + "\" is not a relationship",
          owner.name(), column.propertyName());
    }
    return find(column.relatedModel()).orElseThrow(() -> new SchemaResolutionException(
        "Unable to find model schema (" + column.relatedModel() + ") specified for \"" + column.propertyName()
            + "\" on \"" + owner.name() + "\"",
        owner.name(), column.propertyName()));
  }

  /** Primary key column of the model referenced by a relationship column of {@code owner}. */
  default ColumnMetadata relatedPrimaryKey(ModelMetadata owner, ColumnMetadata column) {
    ModelMetadata related = relatedModel(owner, column);
    ColumnMetadata pk = related.primaryKeyColumn();
    if (pk == null) {
      throw new SchemaResolutionException("Unable to find primary key column for " + related.name()
          + " specified for " + owner.name() + "." + column.propertyName(), owner.name(), column.propertyName());
    }
    return pk;
  }
}
