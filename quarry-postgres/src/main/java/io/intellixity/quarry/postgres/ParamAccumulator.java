package io.intellixity.quarry.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered parameter list shared by every fragment of one statement.\n
 *
 * Placeholders are 1-based and positional ({@code $1, $2, ...}); nested subqueries and join conditions append to the
 * same accumulator so numbering stays contiguous across the whole statement.\n
 */
public final class ParamAccumulator {
  private final List<Object> params = new ArrayList<>();

  /** Appends a value and returns its placeholder. */
  public String add(Object value) {
    params.add(value);
    return "$" + params.size();
  }

  public int size() { return params.size(); }

  public List<Object> values() {
    return Collections.unmodifiableList(params);
  }
}
