package io.intellixity.sqlchain.jdbc.sqlite;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.jdbc.dialect.SqlDialectProvider;

/** Registers {@link SqliteDialect} under {@code "sqlite"}. */
public final class SqliteDialectProvider implements SqlDialectProvider {
  @Override public String id() { return "sqlite"; }

  @Override
  public AbstractSqlDialect<?> create() {
    return new SqliteDialect();
  }
}
