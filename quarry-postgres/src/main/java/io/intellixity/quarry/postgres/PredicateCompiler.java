package io.intellixity.quarry.postgres;

import io.intellixity.quarry.query.*;
import io.intellixity.quarry.schema.ColumnMetadata;
import io.intellixity.quarry.schema.ModelMetadata;
import io.intellixity.quarry.schema.ModelRegistry;

import java.util.*;

import static io.intellixity.quarry.postgres.PgIdentifiers.quote;

/**
 * Compiles where-expression maps into Postgres boolean SQL with positional parameters.\n
 *
 * The expression is walked recursively with a negation flag. {@code not} flips the flag (so double negation
 * cancels); under negation comparisons invert, OR becomes AND and vice versa. Keys are classified by
 * {@link WhereKey}: reserved tokens are operators, anything else is a property (or {@code alias.property} when
 * joins are declared).\n
 *
 * Instances hold no per-statement state and may be shared across threads.\n
 */
public final class PredicateCompiler {
  private final ModelRegistry registry;
  private final ComparisonBuilder comparisons = new ComparisonBuilder();
  private final SubqueryRenderer subqueries;

  public PredicateCompiler(ModelRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.subqueries = new SubqueryRenderer(this);
  }

  public ModelRegistry registry() { return registry; }

  SubqueryRenderer subqueries() { return subqueries; }

  /** Join resolver for a statement rooted at {@code model}. */
  public JoinResolver joins(ModelMetadata model, List<JoinDefinition> joins) {
    return new JoinResolver(registry, model, joins);
  }

  /** Boolean expression for {@code where}, or empty when there is nothing to filter. */
  public String compile(ModelMetadata model, Map<String, ?> where, ParamAccumulator params) {
    return compile(model, where, params, JoinResolver.none(registry, model));
  }

  public String compile(ModelMetadata model, Map<String, ?> where, ParamAccumulator params, JoinResolver joins) {
    if (where == null || where.isEmpty()) return "";
    return map(new Scope(model, joins, params, null), null, false, where);
  }

  /** {@code " WHERE ..."} or empty. */
  public String whereClause(ModelMetadata model, Map<String, ?> where, ParamAccumulator params, JoinResolver joins) {
    String sql = compile(model, where, params, joins);
    return sql.isBlank() ? "" : " WHERE " + sql;
  }

  /** Compiles with root columns qualified by {@code qualifier}; used for extra join conditions. */
  String compileQualified(ModelMetadata model, Map<String, ?> where, ParamAccumulator params, String qualifier) {
    if (where == null || where.isEmpty()) return "";
    return map(new Scope(model, JoinResolver.none(registry, model), params, qualifier), null, false, where);
  }

  /** Quoted column for a property or {@code alias.property}; fails on unknown properties and aliases. */
  public String columnSql(ModelMetadata model, JoinResolver joins, String property) {
    ColumnRef joined = joins.resolve(property);
    if (joined != null) return joined.sql();
    return quote(ModelColumns.require(model, property).name());
  }

  private record Scope(ModelMetadata model, JoinResolver joins, ParamAccumulator params, String qualifier) {}

  private String map(Scope s, String property, boolean negated, Map<?, ?> where) {
    List<String> parts = new ArrayList<>();
    for (Map.Entry<?, ?> e : where.entrySet()) {
      String key = String.valueOf(e.getKey());
      WhereKey k = WhereKey.classify(key);
      String sql = (k == WhereKey.PROPERTY)
          ? value(s, key, null, negated, e.getValue())
          : operator(s, property, k, negated, e.getValue());
      if (!sql.isBlank()) parts.add(sql);
    }
    return String.join(" AND ", parts);
  }

  private String operator(Scope s, String property, WhereKey k, boolean negated, Object value) {
    return switch (k) {
      case NOT -> value(s, property, null, !negated, value);
      case OR, AND -> logical(s, k, negated, value);
      case LIKE -> like(s, property, negated, value);
      case CONTAINS -> isJsonColumn(s, property)
          ? jsonContains(s, column(s, property), negated, value)
          : like(s, property, negated, wildcard(s, property, k, value));
      case STARTS_WITH, ENDS_WITH -> like(s, property, negated, wildcard(s, property, k, value));
      case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL -> value(s, property, k, negated, value);
      case IN -> in(s, property, negated, value);
      case EXISTS -> exists(s, negated, value);
      case PROPERTY -> value(s, property, null, negated, value);
    };
  }

  private String value(Scope s, String property, WhereKey comparer, boolean negated, Object value) {
    value = normalize(value);

    if (value instanceof Map<?, ?> m) {
      if (property == null) return map(s, null, negated, m);
      ColumnRef ref = column(s, property);
      Object id = keyOf(ref, m);
      if (id != null) return value(s, property, comparer, negated, id);
      return map(s, property, negated, m);
    }

    if (value instanceof List<?> items) {
      if (comparer != null) {
        throw new TypeConstraintException(comparer.token() + " operator does not accept an array value. "
            + property + " on " + s.model().name(), s.model().name(), property);
      }
      return list(s, property, negated, items);
    }

    if (value instanceof ScalarSubquery scalar) {
      String rhs = "(" + subqueries.renderScalar(scalar, s.params()) + ")";
      return comparisons.buildAgainst(column(s, property), comparer, negated, rhs);
    }

    if (value instanceof Subquery) {
      throw new StructuralException("Subquery value for \"" + property + "\" must be wrapped in \"in\" or \"exists\"",
          s.model().name(), property);
    }

    return comparisons.build(column(s, property), comparer, negated, value, s.params());
  }

  private String list(Scope s, String property, boolean negated, List<?> items) {
    if (items.isEmpty()) {
      if (property != null) {
        ColumnRef ref = column(s, property);
        if (ref.isArrayType()) return ref.sql() + (negated ? "<>" : "=") + "'{}'";
      }
      return negated ? "1=1" : "1<>1";
    }

    List<String> branches = new ArrayList<>();
    List<Object> rest = new ArrayList<>();
    for (Object item : items) {
      if (item == null || "".equals(item)) branches.add(value(s, property, null, negated, item));
      else rest.add(item);
    }

    if (rest.size() == 1) {
      branches.add(value(s, property, null, negated, rest.get(0)));
    } else if (rest.size() > 1) {
      ColumnRef ref = column(s, property);
      List<Object> keys = new ArrayList<>();
      boolean scalars = !ref.isArrayType() && !ref.isJson();
      for (Object item : rest) {
        Object v = normalize(item);
        if (v instanceof Map<?, ?> m) {
          Object id = keyOf(ref, m);
          if (id == null) scalars = false;
          v = id == null ? v : id;
        } else if (v instanceof List<?> || v instanceof Subquery || v instanceof ScalarSubquery) {
          scalars = false;
        }
        keys.add(v);
      }
      if (scalars) {
        String p = s.params().add(keys);
        String cast = arrayCast(ref);
        branches.add(ref.sql() + (negated ? "<>ALL(" : "=ANY(") + p + "::" + cast + "[])");
      } else {
        for (Object item : rest) branches.add(value(s, property, null, negated, item));
      }
    }
    return combine(branches, negated);
  }

  private String logical(Scope s, WhereKey k, boolean negated, Object value) {
    String token = k.token();
    value = normalize(value);
    List<?> branches;
    if (value instanceof List<?> l) branches = l;
    else if (k == WhereKey.AND && value instanceof Map<?, ?> m) branches = List.of(m);
    else throw new StructuralException("\"" + token + "\" expects an array of where expressions", s.model().name(), null);
    if (branches.isEmpty()) {
      throw new StructuralException("\"" + token + "\" requires at least one where expression", s.model().name(), null);
    }

    List<String> clauses = new ArrayList<>();
    for (Object b : branches) {
      if (!(b instanceof Map<?, ?> m)) {
        throw new StructuralException("\"" + token + "\" branches must be where expressions: " + b, s.model().name(), null);
      }
      String sql = map(s, null, negated, m);
      if (sql.isBlank()) {
        throw new StructuralException("\"" + token + "\" branches must not be empty", s.model().name(), null);
      }
      clauses.add("(" + sql + ")");
    }
    if (clauses.size() == 1) return clauses.get(0);

    boolean orJoin = (k == WhereKey.OR) != negated;
    if (!orJoin && negated) return String.join(" AND ", clauses);
    return "(" + String.join(orJoin ? " OR " : " AND ", clauses) + ")";
  }

  private String like(Scope s, String property, boolean negated, Object value) {
    value = normalize(value);
    if (value instanceof List<?> items) {
      if (items.isEmpty()) return negated ? "1=1" : "1<>1";
      if (items.size() > 1) {
        List<String> branches = new ArrayList<>();
        for (Object item : items) branches.add(like(s, property, negated, item));
        return combine(branches, negated);
      }
      value = items.get(0);
    }

    ColumnRef ref = column(s, property);
    rejectJson(ref);
    if (value == null) return ref.sql() + (negated ? " IS NOT NULL" : " IS NULL");
    if (!(value instanceof String str)) {
      throw new TypeConstraintException("Expected value to be a string for \"like\" constraint. Property ("
          + ref.propertyName() + ") in model (" + ref.modelName() + ").", ref.modelName(), ref.propertyName());
    }
    if (str.isEmpty()) return ref.sql() + (negated ? " != ''" : " = ''");

    String p = s.params().add(str);
    if (ref.isStringArrayType()) {
      String element = quote("unnested_" + ref.name());
      return (negated ? "NOT EXISTS" : "EXISTS") + "(SELECT 1 FROM (SELECT unnest(" + ref.sql() + ") AS " + element
          + ") __unnested WHERE " + element + " ILIKE " + p + ")";
    }
    return ref.sql() + (negated ? " NOT ILIKE " : " ILIKE ") + p;
  }

  private Object wildcard(Scope s, String property, WhereKey k, Object value) {
    ColumnRef ref = column(s, property);
    rejectJson(ref);
    value = normalize(value);
    if (value instanceof List<?> items) {
      List<Object> out = new ArrayList<>();
      for (Object item : items) {
        if (!(item instanceof String str)) {
          throw new TypeConstraintException("Expected all array values to be strings for \"" + k.token()
              + "\" constraint. Property (" + ref.propertyName() + ") in model (" + ref.modelName() + ").",
              ref.modelName(), ref.propertyName());
        }
        out.add(wrap(k, str));
      }
      return out;
    }
    if (!(value instanceof String str)) {
      throw new TypeConstraintException("Expected value to be a string for \"" + k.token() + "\" constraint. Property ("
          + ref.propertyName() + ") in model (" + ref.modelName() + ").", ref.modelName(), ref.propertyName());
    }
    return wrap(k, str);
  }

  private static String wrap(WhereKey k, String value) {
    return switch (k) {
      case CONTAINS -> "%" + value + "%";
      case STARTS_WITH -> value + "%";
      case ENDS_WITH -> "%" + value;
      default -> value;
    };
  }

  private String in(Scope s, String property, boolean negated, Object value) {
    value = normalize(value);
    if (value instanceof List<?>) return value(s, property, null, negated, value);
    if (!(value instanceof Subquery sq)) {
      throw new TypeConstraintException("Expected a subquery or an array for \"in\" on \"" + property + "\"",
          s.model().name(), property);
    }
    ColumnRef ref = column(s, property);
    return ref.sql() + (negated ? " NOT IN (" : " IN (") + subqueries.renderInList(sq, s.params()) + ")";
  }

  private String exists(Scope s, boolean negated, Object value) {
    if (!(value instanceof Subquery sq)) {
      throw new TypeConstraintException("Expected a subquery for \"exists\"", s.model().name(), null);
    }
    return (negated ? "NOT EXISTS (" : "EXISTS (") + subqueries.renderExists(sq, s.params()) + ")";
  }

  private boolean isJsonColumn(Scope s, String property) {
    return property != null && column(s, property).isJson();
  }

  private static void rejectJson(ColumnRef ref) {
    if (ref.isJson()) {
      throw new TypeConstraintException("\"like\" operator is not supported for JSON columns. Property ("
          + ref.propertyName() + ") in model (" + ref.modelName() + ").", ref.modelName(), ref.propertyName());
    }
  }

  /** {@code "c"@>$n::jsonb} per value; null is IS NULL, arrays fan out. */
  private String jsonContains(Scope s, ColumnRef ref, boolean negated, Object value) {
    value = normalize(value);
    if (value == null) return comparisons.build(ref, null, negated, null, s.params());
    if (value instanceof List<?> items) {
      if (items.isEmpty()) return negated ? "1=1" : "1<>1";
      List<String> branches = new ArrayList<>();
      for (Object item : items) branches.add(jsonContains(s, ref, negated, item));
      return combine(branches, negated);
    }
    String p = s.params().add(JsonParams.write(value, ref.modelName(), ref.propertyName()));
    return (negated ? "NOT " : "") + ref.sql() + "@>" + p + "::jsonb";
  }

  /** Primary key carried by a hydrated record for key and relationship columns, else null. */
  private Object keyOf(ColumnRef ref, Map<?, ?> value) {
    ColumnMetadata c = ref.metadata();
    if (c == null) return null;
    if (c.primary()) return value.get(c.propertyName());
    if (c.isRelationship()) {
      ColumnMetadata pk = registry.relatedPrimaryKey(ref.owner(), c);
      return ForeignKeyRef.resolve(value, pk.propertyName()).map(ForeignKeyRef::id).orElse(null);
    }
    return null;
  }

  private String arrayCast(ColumnRef ref) {
    ColumnMetadata c = ref.metadata();
    if (c == null) return "TEXT";
    String type = c.isRelationship() ? registry.relatedPrimaryKey(ref.owner(), c).typeLowered() : c.typeLowered();
    return switch (type) {
      case "int", "integer", "integer[]" -> "INTEGER";
      case "float", "float[]" -> "NUMERIC";
      case "boolean", "boolean[]" -> "BOOLEAN";
      case "uuid" -> "UUID";
      default -> "TEXT";
    };
  }

  private ColumnRef column(Scope s, String property) {
    if (property == null) {
      throw new StructuralException("Value requires a property in where expression for " + s.model().name(),
          s.model().name(), null);
    }
    ColumnRef joined = s.joins().resolve(property);
    if (joined != null) return joined;
    return ColumnRef.local(s.model(), ModelColumns.require(s.model(), property), s.qualifier());
  }

  private static String combine(List<String> branches, boolean negated) {
    if (branches.size() == 1) return branches.get(0);
    return negated ? String.join(" AND ", branches) : "(" + String.join(" OR ", branches) + ")";
  }

  private static Object normalize(Object value) {
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    if (value instanceof Collection<?> c && !(value instanceof List<?>)) return new ArrayList<>(c);
    return value;
  }
}
