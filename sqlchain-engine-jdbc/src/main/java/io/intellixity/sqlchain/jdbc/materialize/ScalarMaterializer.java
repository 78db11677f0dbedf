package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.RowCursor;

/** One value from the first row: a named column, or the first column. {@code null} when there is no row. */
public final class ScalarMaterializer<T> implements Materializer<T> {
  private final Class<T> type;
  private final String columnName;

  ScalarMaterializer(Class<T> type, String columnName) {
    this.type = type;
    this.columnName = columnName;
  }

  @Override
  public DesiredColumns desiredColumns() {
    return (columnName == null) ? DesiredColumns.all() : DesiredColumns.of(columnName);
  }

  @Override
  public T fromRows(ExecutionToken source, RowCursor rows) {
    if (!rows.next()) return null;
    int index = 0;
    if (columnName != null) {
      index = -1;
      for (int i = 0; i < rows.fieldCount(); i++) {
        if (rows.name(i).equalsIgnoreCase(columnName)) { index = i; break; }
      }
      if (index < 0) throw new MappingException("Column " + columnName + " is not in the result of: " + source.commandText());
    }
    Object raw = rows.getObject(index);
    if (raw == null) return null;
    @SuppressWarnings("unchecked")
    T v = (T) ValueConverter.convert(raw, type);
    return v;
  }
}
