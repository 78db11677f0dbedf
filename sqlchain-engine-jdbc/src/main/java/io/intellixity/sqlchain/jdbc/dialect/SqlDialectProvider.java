package io.intellixity.sqlchain.jdbc.dialect;

/**
 * Contributes a dialect to {@link DialectRegistry}. Registered in {@code META-INF/sqlchain.factories}.
 */
public interface SqlDialectProvider {
  /** Lookup id, e.g. {@code "postgres"}. */
  String id();

  AbstractSqlDialect<?> create();
}
