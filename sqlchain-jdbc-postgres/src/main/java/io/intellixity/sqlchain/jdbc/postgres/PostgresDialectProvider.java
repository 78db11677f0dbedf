package io.intellixity.sqlchain.jdbc.postgres;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.jdbc.dialect.SqlDialectProvider;

public final class PostgresDialectProvider implements SqlDialectProvider {
  @Override public String id() { return "postgres"; }

  @Override
  public AbstractSqlDialect<?> create() {
    return new PostgresDialect();
  }
}
