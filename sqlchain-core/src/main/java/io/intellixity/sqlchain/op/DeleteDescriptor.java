package io.intellixity.sqlchain.op;

import java.util.Objects;
import java.util.Set;

/** Delete of one row by key, or of every row matching a filter. */
public final class DeleteDescriptor {
  private final String tableName;
  private final Object argumentValue;
  private final TableFilter filter;
  private final boolean allRows;
  private final Set<DeleteOptions> options;
  private final Integer expectedRowCount;

  private DeleteDescriptor(String tableName, Object argumentValue, TableFilter filter, boolean allRows,
                           Set<DeleteOptions> options, Integer expectedRowCount) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.argumentValue = argumentValue;
    this.filter = filter;
    this.allRows = allRows;
    this.options = Set.copyOf(options);
    this.expectedRowCount = expectedRowCount;
  }

  public static DeleteDescriptor byKey(String tableName, Object value, DeleteOptions... options) {
    Objects.requireNonNull(value, "value");
    return new DeleteDescriptor(tableName, value, null, false, UpdateDescriptor.toSet(options), null);
  }

  public static DeleteDescriptor where(String tableName, TableFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return new DeleteDescriptor(tableName, null, filter, false, Set.of(), null);
  }

  public static DeleteDescriptor allRows(String tableName) {
    return new DeleteDescriptor(tableName, null, null, true, Set.of(), null);
  }

  public String tableName() { return tableName; }
  public Object argumentValue() { return argumentValue; }
  public TableFilter filter() { return filter; }
  public boolean allRows() { return allRows; }
  public boolean byKey() { return argumentValue != null; }
  public Set<DeleteOptions> options() { return options; }
  public boolean has(DeleteOptions option) { return options.contains(option); }
  public Integer expectedRowCount() { return expectedRowCount; }

  public DeleteDescriptor withExpectedRowCount(Integer expectedRowCount) {
    if (expectedRowCount != null && expectedRowCount < 0) throw new IllegalArgumentException("expectedRowCount must be >= 0");
    return new DeleteDescriptor(tableName, argumentValue, filter, allRows, options, expectedRowCount);
  }
}
