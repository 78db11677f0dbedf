package io.intellixity.sqlchain.op;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Update of one row by key ({@link #byKey}) or of every row matching a filter ({@link #set}, {@link #setExpression}).\n
 *
 * Set-based updates need a filter or an explicit {@link #withAllRows()}.
 */
public final class UpdateDescriptor {
  private final String tableName;
  private final Object argumentValue;
  private final String updateExpression;
  private final Object expressionArguments;
  private final TableFilter filter;
  private final boolean allRows;
  private final boolean byKey;
  private final Set<UpdateOptions> options;
  private final Integer expectedRowCount;

  private UpdateDescriptor(String tableName, Object argumentValue, String updateExpression, Object expressionArguments,
                           TableFilter filter, boolean allRows, boolean byKey, Set<UpdateOptions> options,
                           Integer expectedRowCount) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.argumentValue = argumentValue;
    this.updateExpression = updateExpression;
    this.expressionArguments = expressionArguments;
    this.filter = filter;
    this.allRows = allRows;
    this.byKey = byKey;
    this.options = Set.copyOf(options);
    this.expectedRowCount = expectedRowCount;
  }

  /** Update the row identified by the key properties of {@code value}; other properties become the new values. */
  public static UpdateDescriptor byKey(String tableName, Object value, UpdateOptions... options) {
    Objects.requireNonNull(value, "value");
    return new UpdateDescriptor(tableName, value, null, null, null, false, true, toSet(options), null);
  }

  /** Set columns from the properties (or Map entries) of {@code newValues} on rows matching a filter. */
  public static UpdateDescriptor set(String tableName, Object newValues, UpdateOptions... options) {
    Objects.requireNonNull(newValues, "newValues");
    rejectKeyAttribute(options);
    return new UpdateDescriptor(tableName, newValues, null, null, null, false, false, toSet(options), null);
  }

  /** Set columns with a caller-written expression such as {@code "Status = :status"}. */
  public static UpdateDescriptor setExpression(String tableName, String updateExpression, Object arguments,
                                               UpdateOptions... options) {
    Objects.requireNonNull(updateExpression, "updateExpression");
    if (updateExpression.isBlank()) throw new IllegalArgumentException("updateExpression is blank");
    rejectKeyAttribute(options);
    return new UpdateDescriptor(tableName, null, updateExpression, arguments, null, false, false, toSet(options), null);
  }

  public String tableName() { return tableName; }
  public Object argumentValue() { return argumentValue; }
  public String updateExpression() { return updateExpression; }
  public Object expressionArguments() { return expressionArguments; }
  public TableFilter filter() { return filter; }
  public boolean allRows() { return allRows; }
  public boolean byKey() { return byKey; }
  public Set<UpdateOptions> options() { return options; }
  public boolean has(UpdateOptions option) { return options.contains(option); }

  /** Caller-supplied affected-row expectation, or {@code null}. */
  public Integer expectedRowCount() { return expectedRowCount; }

  public UpdateDescriptor withFilter(Object filterValue) {
    return withTableFilter(new ValueFilter(filterValue, FilterOptions.NONE));
  }

  public UpdateDescriptor withFilter(String whereClause, Object argumentValue) {
    return withTableFilter(new WhereClauseFilter(whereClause, argumentValue));
  }

  public UpdateDescriptor withTableFilter(TableFilter filter) {
    if (byKey) throw new IllegalStateException("Updates by key are filtered by their key properties");
    return new UpdateDescriptor(tableName, argumentValue, updateExpression, expressionArguments, filter, false, false,
        options, expectedRowCount);
  }

  public UpdateDescriptor withAllRows() {
    if (byKey) throw new IllegalStateException("Updates by key are filtered by their key properties");
    return new UpdateDescriptor(tableName, argumentValue, updateExpression, expressionArguments, null, true, false,
        options, expectedRowCount);
  }

  public UpdateDescriptor withExpectedRowCount(Integer expectedRowCount) {
    if (expectedRowCount != null && expectedRowCount < 0) throw new IllegalArgumentException("expectedRowCount must be >= 0");
    return new UpdateDescriptor(tableName, argumentValue, updateExpression, expressionArguments, filter, allRows, byKey,
        options, expectedRowCount);
  }

  private static void rejectKeyAttribute(UpdateOptions[] options) {
    for (UpdateOptions o : options) {
      if (o == UpdateOptions.USE_KEY_ATTRIBUTE) {
        throw new IllegalArgumentException("USE_KEY_ATTRIBUTE is not supported by set-based updates");
      }
    }
  }

  static <E extends Enum<E>> Set<E> toSet(E[] values) {
    if (values.length == 0) return Set.of();
    Set<E> out = EnumSet.of(values[0]);
    out.addAll(List.of(values));
    return out;
  }
}
