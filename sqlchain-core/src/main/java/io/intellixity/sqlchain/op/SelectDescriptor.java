package io.intellixity.sqlchain.op;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a select from one table or view.\n
 *
 * Every {@code with*} call returns a new descriptor. Setting a filter replaces the previous one, whatever its kind.
 */
@JsonSerialize(using = SelectDescriptorJsonSerializer.class)
@JsonDeserialize(using = SelectDescriptorJsonDeserializer.class)
public final class SelectDescriptor {
  private final String tableName;
  private final TableFilter filter;
  private final List<SortExpression> sort;
  private final Limits limits;

  private SelectDescriptor(String tableName, TableFilter filter, List<SortExpression> sort, Limits limits) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    if (tableName.isBlank()) throw new IllegalArgumentException("tableName is empty");
    this.filter = filter;
    this.sort = List.copyOf(sort);
    this.limits = Objects.requireNonNull(limits, "limits");
  }

  public static SelectDescriptor from(String tableName) {
    return new SelectDescriptor(tableName, null, List.of(), Limits.NONE);
  }

  public String tableName() { return tableName; }

  /** Active filter, or {@code null}. */
  public TableFilter filter() { return filter; }

  public List<SortExpression> sort() { return sort; }

  public Limits limits() { return limits; }

  public SelectDescriptor withFilter(Object filterValue) {
    return withFilter(filterValue, FilterOptions.NONE);
  }

  public SelectDescriptor withFilter(Object filterValue, FilterOptions options) {
    return withTableFilter(new ValueFilter(filterValue, options));
  }

  public SelectDescriptor withFilter(String whereClause) {
    return withTableFilter(new WhereClauseFilter(whereClause, null));
  }

  public SelectDescriptor withFilter(String whereClause, Object argumentValue) {
    return withTableFilter(new WhereClauseFilter(whereClause, argumentValue));
  }

  public SelectDescriptor withTableFilter(TableFilter filter) {
    return new SelectDescriptor(tableName, filter, sort, limits);
  }

  public SelectDescriptor withSorting(SortExpression... sortExpressions) {
    Objects.requireNonNull(sortExpressions, "sortExpressions");
    return withSorting(Arrays.asList(sortExpressions));
  }

  public SelectDescriptor withSorting(List<SortExpression> sortExpressions) {
    Objects.requireNonNull(sortExpressions, "sortExpressions");
    return new SelectDescriptor(tableName, filter, sortExpressions, limits);
  }

  public SelectDescriptor withLimits(Integer skip, Integer take) {
    return withLimits(new Limits(skip, take, LimitOptions.ROWS, null));
  }

  public SelectDescriptor withLimits(Integer skip, Integer take, LimitOptions options, Integer seed) {
    return withLimits(new Limits(skip, take, options, seed));
  }

  public SelectDescriptor withLimits(Limits limits) {
    return new SelectDescriptor(tableName, filter, sort, limits == null ? Limits.NONE : limits);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SelectDescriptor that)) return false;
    return tableName.equals(that.tableName) && Objects.equals(filter, that.filter)
        && sort.equals(that.sort) && limits.equals(that.limits);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, filter, sort, limits);
  }

  @Override
  public String toString() {
    return "SelectDescriptor[" + tableName + ", filter=" + filter + ", sort=" + sort + ", limits=" + limits + "]";
  }
}
