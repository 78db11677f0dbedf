package io.intellixity.sqlchain.op;

import java.util.Objects;

public record SortExpression(String columnName, Direction direction) {
  public SortExpression {
    Objects.requireNonNull(columnName, "columnName");
    if (columnName.isBlank()) throw new IllegalArgumentException("columnName is blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortExpression asc(String columnName) {
    return new SortExpression(columnName, Direction.ASC);
  }

  public static SortExpression desc(String columnName) {
    return new SortExpression(columnName, Direction.DESC);
  }

  public enum Direction { ASC, DESC }
}
