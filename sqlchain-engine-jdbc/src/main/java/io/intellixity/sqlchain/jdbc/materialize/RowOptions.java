package io.intellixity.sqlchain.jdbc.materialize;

public enum RowOptions {
  /** No row yields {@code null} instead of {@link io.intellixity.sqlchain.spi.MissingDataException}. */
  ALLOW_EMPTY_RESULTS,
  /** Rows after the first are ignored instead of raising {@link io.intellixity.sqlchain.spi.UnexpectedDataException}. */
  DISCARD_EXTRA_ROWS,
  /** Bind through the type's single non-default constructor. */
  INFER_CONSTRUCTOR
}
