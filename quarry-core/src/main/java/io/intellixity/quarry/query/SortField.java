package io.intellixity.quarry.query;

import java.util.Objects;

public record SortField(String property, Direction direction) {
  public SortField {
    Objects.requireNonNull(property, "property");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String property) { return new SortField(property, Direction.ASC); }
  public static SortField desc(String property) { return new SortField(property, Direction.DESC); }

  public boolean descending() { return direction == Direction.DESC; }

  public enum Direction { ASC, DESC }
}
