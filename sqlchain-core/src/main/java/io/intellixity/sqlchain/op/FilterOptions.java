package io.intellixity.sqlchain.op;

public enum FilterOptions {
  NONE,
  /** Null-valued properties are left out of the filter instead of becoming {@code IS NULL}. */
  IGNORE_NULL_PROPERTIES
}
