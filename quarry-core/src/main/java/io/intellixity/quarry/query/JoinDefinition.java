package io.intellixity.quarry.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A join from the statement's root model to a related model or to a derived (subquery) table. */
public sealed interface JoinDefinition permits JoinDefinition.ModelJoin, JoinDefinition.SubqueryJoin {
  String alias();
  JoinType type();

  /**
   * Join through a many-to-one relationship property. {@code on} holds extra conditions against the related model,
   * AND-ed to the key equality.
   */
  record ModelJoin(String propertyName, String alias, JoinType type, Map<String, ?> on) implements JoinDefinition {
    public ModelJoin {
      Objects.requireNonNull(propertyName, "propertyName");
      alias = (alias == null || alias.isBlank()) ? propertyName : alias;
      type = type == null ? JoinType.INNER : type;
    }

    public ModelJoin on(Map<String, ?> conditions) {
      return new ModelJoin(propertyName, alias, type, conditions);
    }
  }

  /** Join to a subquery. {@code on} maps root-model property to subquery output column. */
  record SubqueryJoin(Subquery subquery, String alias, JoinType type, Map<String, String> on) implements JoinDefinition {
    public SubqueryJoin {
      Objects.requireNonNull(subquery, "subquery");
      Objects.requireNonNull(alias, "alias");
      type = type == null ? JoinType.INNER : type;
      on = on == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(on));
    }
  }

  static ModelJoin inner(String propertyName) { return new ModelJoin(propertyName, null, JoinType.INNER, null); }
  static ModelJoin inner(String propertyName, String alias) { return new ModelJoin(propertyName, alias, JoinType.INNER, null); }
  static ModelJoin left(String propertyName) { return new ModelJoin(propertyName, null, JoinType.LEFT, null); }
  static ModelJoin left(String propertyName, String alias) { return new ModelJoin(propertyName, alias, JoinType.LEFT, null); }

  static SubqueryJoin inner(Subquery subquery, String alias, Map<String, String> on) {
    return new SubqueryJoin(subquery, alias, JoinType.INNER, on);
  }

  static SubqueryJoin left(Subquery subquery, String alias, Map<String, String> on) {
    return new SubqueryJoin(subquery, alias, JoinType.LEFT, on);
  }
}
