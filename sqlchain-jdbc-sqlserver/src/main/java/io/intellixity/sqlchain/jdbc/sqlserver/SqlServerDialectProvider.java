package io.intellixity.sqlchain.jdbc.sqlserver;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.jdbc.dialect.SqlDialectProvider;

public final class SqlServerDialectProvider implements SqlDialectProvider {
  @Override public String id() { return "sqlserver"; }

  @Override
  public AbstractSqlDialect<?> create() {
    return new SqlServerDialect();
  }
}
