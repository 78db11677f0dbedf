package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.spi.RowCursor;

/** Builds one object from the cursor's current row. */
@FunctionalInterface
public interface RowBinder<T> {
  T bind(RowCursor row);
}
