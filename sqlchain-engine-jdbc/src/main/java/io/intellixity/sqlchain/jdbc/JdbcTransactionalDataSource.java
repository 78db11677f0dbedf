package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.jdbc.cache.ResultCache;
import io.intellixity.sqlchain.jdbc.dialect.SqlCommandBuilder;
import io.intellixity.sqlchain.jdbc.materialize.Materializers;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.TransactionalContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * A transaction on one JDBC connection. Shares the catalog, builder, binder cache and result cache of the
 * data source that started it.
 *
 * @param <N> the dialect's object name type
 */
public final class JdbcTransactionalDataSource<N> extends TransactionalContext implements SqlOperations<N> {
  private final JdbcDataSource<N> parent;
  private final Connection connection;
  private final NativeCommandFactory commands;

  JdbcTransactionalDataSource(JdbcDataSource<N> parent, Connection connection, Executor asyncExecutor) {
    super(asyncExecutor, parent.settings().disableLocks());
    this.parent = parent;
    this.connection = connection;
    this.commands = (text, type, params, timeout) ->
        new JdbcNativeCommand(connection, false, text, type, params, timeout);
  }

  @Override
  public SqlCommandBuilder<N> builder() { return parent.builder(); }

  @Override
  public Materializers materializers() { return parent.materializers(); }

  @Override
  public ResultCache resultCache() { return parent.resultCache(); }

  @Override
  protected NativeCommandFactory commands() {
    return commands;
  }

  @Override
  protected Duration defaultCommandTimeout() {
    return parent.settings().defaultCommandTimeout();
  }

  @Override
  protected void doCommit() {
    try {
      connection.commit();
    } catch (SQLException e) {
      throw new UncheckedSqlException(null, e);
    }
  }

  @Override
  protected void doRollback() {
    try {
      connection.rollback();
    } catch (SQLException e) {
      throw new UncheckedSqlException(null, e);
    }
  }

  @Override
  protected void doClose() {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new UncheckedSqlException(null, e);
    }
  }

  @Override
  public String toString() {
    return "JdbcTransactionalDataSource[" + parent.dialect().id() + "]";
  }
}
