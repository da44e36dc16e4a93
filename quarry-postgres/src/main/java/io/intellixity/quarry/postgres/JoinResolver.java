package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.JoinDefinition;
import io.intellixity.quarry.query.SchemaResolutionException;
import io.intellixity.quarry.query.StructuralException;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;
import io.intellixity.quarry.schema.ModelRegistry;

import java.util.*;

import static io.intellixity.quarry.postgres.PgIdentifiers.quote;

/**
 * Joins declared on one statement, keyed by alias.\n
 *
 * Resolves dot-path references ({@code alias.property}) to qualified columns and renders the JOIN clauses.
 * Model joins go through a relationship property of the root model; subquery joins attach a derived table.\n
 */
public final class JoinResolver {
  private final ModelRegistry registry;
  private final ModelMetadata root;
  private final Map<String, JoinDefinition> byAlias;

  JoinResolver(ModelRegistry registry, ModelMetadata root, List<JoinDefinition> joins) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.root = Objects.requireNonNull(root, "root");
    Map<String, JoinDefinition> m = new LinkedHashMap<>();
    if (joins != null) {
      for (JoinDefinition j : joins) {
        PgIdentifiers.requireValid(j.alias(), "join alias");
        if (m.put(j.alias(), j) != null) {
          throw new StructuralException("Duplicate join alias \"" + j.alias() + "\" on " + root.name(), root.name(), null);
        }
      }
    }
    this.byAlias = Collections.unmodifiableMap(m);
  }

  static JoinResolver none(ModelRegistry registry, ModelMetadata root) {
    return new JoinResolver(registry, root, List.of());
  }

  public boolean isEmpty() { return byAlias.isEmpty(); }

  /**
   * Resolves {@code alias.property}. Returns null for a path without a dot, which the caller resolves against the
   * root model.
   */
  ColumnRef resolve(String path) {
    int dot = path.indexOf('.');
    if (dot < 0) return null;
    if (byAlias.isEmpty()) {
      throw new SchemaResolutionException("Cannot use dot notation \"" + path + "\" without a join", root.name(), path);
    }
    String alias = path.substring(0, dot);
    String property = path.substring(dot + 1);
    JoinDefinition join = byAlias.get(alias);
    if (join == null) {
      throw new SchemaResolutionException("Cannot find join for \"" + alias + "\" (referenced by \"" + path + "\")",
          root.name(), path);
    }
    if (join instanceof JoinDefinition.SubqueryJoin) {
      return ColumnRef.derived(alias, PgIdentifiers.requireValid(property, "subquery column"));
    }
    ModelMetadata related = joinedModel((JoinDefinition.ModelJoin) join);
    ColumnMetadata column = related.column(property);
    if (column == null || column.isCollection()) {
      throw new SchemaResolutionException("Unable to find property \"" + property + "\" on model \"" + related.name()
          + "\" (joined as \"" + alias + "\")", related.name(), property);
    }
    return ColumnRef.local(related, column, alias);
  }

  /** Renders every join in declaration order, each with a leading space. */
  public String render(PredicateCompiler compiler, ParamAccumulator params) {
    StringBuilder sql = new StringBuilder();
    for (JoinDefinition join : byAlias.values()) {
      if (join instanceof JoinDefinition.ModelJoin mj) {
        sql.append(renderModelJoin(mj, compiler, params));
      } else if (join instanceof JoinDefinition.SubqueryJoin sj) {
        sql.append(renderSubqueryJoin(sj, compiler, params));
      }
    }
    return sql.toString();
  }

  private String renderModelJoin(JoinDefinition.ModelJoin join, PredicateCompiler compiler, ParamAccumulator params) {
    ColumnMetadata fk = relationshipColumn(join);
    ModelMetadata related = registry.relatedModel(root, fk);
    ColumnMetadata pk = registry.relatedPrimaryKey(root, fk);
    String sql = " " + join.type().sql() + " " + PgIdentifiers.table(related) + " AS " + quote(join.alias())
        + " ON " + quote(root.tableName()) + "." + quote(fk.name()) + "=" + quote(join.alias()) + "." + quote(pk.name());
    if (join.on() != null && !join.on().isEmpty()) {
      String extra = compiler.compileQualified(related, join.on(), params, join.alias());
      if (!extra.isBlank()) sql += " AND " + extra;
    }
    return sql;
  }

  private String renderSubqueryJoin(JoinDefinition.SubqueryJoin join, PredicateCompiler compiler,
                                    ParamAccumulator params) {
    if (join.on().isEmpty()) {
      throw new StructuralException("Subquery join \"" + join.alias() + "\" requires at least one ON condition",
          root.name(), null);
    }
    String derived = compiler.subqueries().renderDerived(join.subquery(), params);
    List<String> conditions = new ArrayList<>();
    for (Map.Entry<String, String> e : join.on().entrySet()) {
      ColumnMetadata local = root.column(e.getKey());
      if (local == null || local.isCollection()) {
        throw new SchemaResolutionException("Unable to find property \"" + e.getKey() + "\" on model \"" + root.name()
            + "\"", root.name(), e.getKey());
      }
      String target = PgIdentifiers.requireValid(e.getValue(), "subquery column");
      conditions.add(quote(root.tableName()) + "." + quote(local.name()) + "=" + quote(join.alias()) + "." + quote(target));
    }
    return " " + join.type().sql() + " (" + derived + ") AS " + quote(join.alias()) + " ON "
        + String.join(" AND ", conditions);
  }

  private ModelMetadata joinedModel(JoinDefinition.ModelJoin join) {
    return registry.relatedModel(root, relationshipColumn(join));
  }

  private ColumnMetadata relationshipColumn(JoinDefinition.ModelJoin join) {
    ColumnMetadata column = root.column(join.propertyName());
    if (column == null) {
      throw new SchemaResolutionException("Unable to find property \"" + join.propertyName() + "\" on model \""
          + root.name() + "\" to join", root.name(), join.propertyName());
    }
    if (!column.isRelationship()) {
      throw new SchemaResolutionException("Property \"" + join.propertyName() + "\" on model \"" + root.name()
          + "\" is not a relationship and cannot be joined", root.name(), join.propertyName());
    }
    return column;
  }
}
