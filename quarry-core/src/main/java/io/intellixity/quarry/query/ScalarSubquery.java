package io.intellixity.quarry.query;

import java.util.Objects;

/** Subquery reduced to a single aggregate value; usable as the right-hand side of a comparison. */
public record ScalarSubquery(Subquery subquery, Aggregate aggregate) {
  public ScalarSubquery {
    Objects.requireNonNull(subquery, "subquery");
    Objects.requireNonNull(aggregate, "aggregate");
  }
}
