package io.intellixity.sqlchain.jdbc.materialize;

/** How a single-column list treats nulls and results with more than one column. */
public enum ListOptions {
  /** Leave NULL values out of the list. */
  IGNORE_NULLS,
  /** Add every column of every row, in column order. */
  FLATTEN_EXTRA_COLUMNS,
  /** Read the first column and ignore the rest. */
  DISCARD_EXTRA_COLUMNS
}
