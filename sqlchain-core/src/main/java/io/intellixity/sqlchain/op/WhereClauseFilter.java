package io.intellixity.sqlchain.op;

import java.util.Objects;

/**
 * Caller-written predicate, used verbatim.\n
 * {@code :name} placeholders are bound from {@code argumentValue} (a Map or an object's properties).
 */
public record WhereClauseFilter(String whereClause, Object argumentValue) implements TableFilter {
  public WhereClauseFilter {
    Objects.requireNonNull(whereClause, "whereClause");
    if (whereClause.isBlank()) throw new IllegalArgumentException("whereClause is blank");
  }
}
