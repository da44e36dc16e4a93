package io.intellixity.quarry.query;

import java.util.List;
import java.util.Map;

/**
 * {@code ON CONFLICT} clause of an insert.
 *
 * @param targets     conflict target properties
 * @param targetWhere optional predicate on the conflict target (partial unique indexes)
 * @param action      what to do with conflicting rows
 * @param merge       properties overwritten from the proposed row; null means every non-key, non-create-date column
 *                    and an empty list degrades to {@code DO NOTHING}
 * @param mergeWhere  optional predicate restricting which conflicting rows are updated
 */
public record OnConflict(List<String> targets, Map<String, ?> targetWhere, Action action, List<String> merge,
                         Map<String, ?> mergeWhere) {
  public enum Action { IGNORE, MERGE }

  public OnConflict {
    if (targets == null || targets.isEmpty()) throw new StructuralException("ON CONFLICT requires at least one target");
    targets = List.copyOf(targets);
    action = action == null ? Action.IGNORE : action;
    merge = merge == null ? null : List.copyOf(merge);
  }

  public static OnConflict ignore(String... targets) {
    return new OnConflict(List.of(targets), null, Action.IGNORE, null, null);
  }

  public static OnConflict merge(String... targets) {
    return new OnConflict(List.of(targets), null, Action.MERGE, null, null);
  }

  public OnConflict mergeOnly(String... properties) {
    return new OnConflict(targets, targetWhere, Action.MERGE, List.of(properties), mergeWhere);
  }

  public OnConflict targetWhere(Map<String, ?> where) {
    return new OnConflict(targets, where, action, merge, mergeWhere);
  }

  public OnConflict mergeWhere(Map<String, ?> where) {
    return new OnConflict(targets, targetWhere, action, merge, where);
  }

  /** True when the rendered action is {@code DO NOTHING}. */
  public boolean doesNothing() {
    return action == Action.IGNORE || (merge != null && merge.isEmpty());
  }
}
