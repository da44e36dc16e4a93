package io.intellixity.quarry.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A rendered SQL statement and its positional parameters. Parameter values may be null. */
public record QueryAndParams(String query, List<Object> params) {
  public QueryAndParams {
    Objects.requireNonNull(query, "query");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  static QueryAndParams of(String query, ParamAccumulator params) {
    return new QueryAndParams(query, params.values());
  }
}
