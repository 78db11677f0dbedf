package io.intellixity.sqlchain.op;

import java.util.Objects;

/**
 * Equality filter from a {@link java.util.Map} or the readable properties of an object.\n
 * Keys are matched to columns ignoring case; nulls become {@code IS NULL}.
 */
public record ValueFilter(Object filterValue, FilterOptions options) implements TableFilter {
  public ValueFilter {
    Objects.requireNonNull(filterValue, "filterValue");
    options = (options == null) ? FilterOptions.NONE : options;
  }
}
