package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.RowCursor;
import io.intellixity.sqlchain.spi.UnexpectedDataException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One column of every row, converted to {@code T}.\n
 *
 * Without a column name the result must have exactly one column, unless {@link ListOptions#FLATTEN_EXTRA_COLUMNS}
 * or {@link ListOptions#DISCARD_EXTRA_COLUMNS} says what to do with the others. NULLs are kept as {@code null}
 * entries unless {@link ListOptions#IGNORE_NULLS} is given.
 */
public final class ColumnListMaterializer<T> implements Materializer<List<T>> {
  private final Class<T> type;
  private final String columnName;
  private final Set<ListOptions> options;

  ColumnListMaterializer(Class<T> type, String columnName, Set<ListOptions> options) {
    if (options.contains(ListOptions.FLATTEN_EXTRA_COLUMNS) && options.contains(ListOptions.DISCARD_EXTRA_COLUMNS)) {
      throw new IllegalArgumentException("FLATTEN_EXTRA_COLUMNS and DISCARD_EXTRA_COLUMNS cannot be combined");
    }
    if (columnName != null && options.contains(ListOptions.FLATTEN_EXTRA_COLUMNS)) {
      throw new IllegalArgumentException("FLATTEN_EXTRA_COLUMNS needs every column; do not name one");
    }
    this.type = type;
    this.columnName = columnName;
    this.options = Set.copyOf(options);
  }

  @Override
  public DesiredColumns desiredColumns() {
    return (columnName == null) ? DesiredColumns.all() : DesiredColumns.of(columnName);
  }

  @Override
  public List<T> fromRows(ExecutionToken source, RowCursor rows) {
    int[] columns = columns(source, rows);
    boolean ignoreNulls = options.contains(ListOptions.IGNORE_NULLS);
    List<T> out = new ArrayList<>();
    while (rows.next()) {
      for (int i : columns) {
        Object raw = rows.getObject(i);
        if (raw == null) {
          if (!ignoreNulls) out.add(null);
          continue;
        }
        @SuppressWarnings("unchecked")
        T v = (T) ValueConverter.convert(raw, type);
        out.add(v);
      }
    }
    return out;
  }

  private int[] columns(ExecutionToken source, RowCursor rows) {
    if (columnName != null) {
      for (int i = 0; i < rows.fieldCount(); i++) {
        if (rows.name(i).equalsIgnoreCase(columnName)) return new int[] {i};
      }
      throw new MappingException("Column " + columnName + " is not in the result of: " + source.commandText());
    }
    int count = rows.fieldCount();
    if (count == 1 || options.contains(ListOptions.DISCARD_EXTRA_COLUMNS)) return new int[] {0};
    if (options.contains(ListOptions.FLATTEN_EXTRA_COLUMNS)) {
      int[] all = new int[count];
      for (int i = 0; i < count; i++) all[i] = i;
      return all;
    }
    throw new UnexpectedDataException("Expected one column but " + count + " were returned from: "
        + source.commandText());
  }
}
