package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.RowCursor;

/** Affected row count of the last write; asks for no read-back. */
public final class RowsAffectedMaterializer implements Materializer<Integer> {
  @Override
  public DesiredColumns desiredColumns() {
    return DesiredColumns.none();
  }

  @Override
  public Integer fromRows(ExecutionToken source, RowCursor rows) {
    throw new IllegalStateException("Rows were returned by a command that asked for none: " + source.commandText());
  }

  @Override
  public Integer fromRowsAffected(Integer rowsAffected) {
    return rowsAffected;
  }
}
