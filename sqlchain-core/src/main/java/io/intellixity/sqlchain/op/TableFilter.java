package io.intellixity.sqlchain.op;

/** The single active filter of an operation: {@link ValueFilter} or {@link WhereClauseFilter}. */
public interface TableFilter {
}
