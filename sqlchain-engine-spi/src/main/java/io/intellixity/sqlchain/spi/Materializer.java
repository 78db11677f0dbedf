package io.intellixity.sqlchain.spi;

/**
 * Turns the outcome of an execution chain into a result.
 *
 * @param <R> result type
 */
public interface Materializer<R> {
  DesiredColumns desiredColumns();

  /** Consumes the rows of the chain's row-returning token {@code source}. */
  R fromRows(ExecutionToken source, RowCursor rows);

  /** Called instead of {@link #fromRows} when no token in the chain returned rows. */
  default R fromRowsAffected(Integer rowsAffected) {
    throw new IllegalStateException(getClass().getSimpleName() + " expects rows but the command returned none");
  }
}
