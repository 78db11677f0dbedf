package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.spi.CommandParameter;
import io.intellixity.sqlchain.spi.CommandType;
import io.intellixity.sqlchain.spi.NativeCommand;
import io.intellixity.sqlchain.spi.RowCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One {@link PreparedStatement} (or {@link CallableStatement} for stored procedures) with its parameters bound.\n
 *
 * When created with {@code ownsConnection}, closing the command also closes the connection.
 */
public final class JdbcNativeCommand implements NativeCommand {
  private static final Logger log = LoggerFactory.getLogger(JdbcNativeCommand.class);

  private final Connection connection;
  private final boolean ownsConnection;
  private final String commandText;
  private final PreparedStatement ps;

  public JdbcNativeCommand(Connection connection, boolean ownsConnection, String commandText, CommandType commandType,
                           List<CommandParameter> parameters, Duration timeout) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.ownsConnection = ownsConnection;
    this.commandText = Objects.requireNonNull(commandText, "commandText");
    PreparedStatement prepared = null;
    try {
      prepared = prepare(connection, commandText, commandType, parameters.size());
      if (timeout != null) prepared.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
      bindAll(prepared, parameters);
    } catch (SQLException e) {
      closeQuietly(prepared);
      throw new UncheckedSqlException(commandText, e);
    } catch (RuntimeException e) {
      closeQuietly(prepared);
      throw e;
    }
    this.ps = prepared;
  }

  @Override
  public RowCursor executeQuery() {
    try {
      return new JdbcRowCursor(ps.executeQuery(), commandText);
    } catch (SQLException e) {
      throw new UncheckedSqlException(commandText, e);
    }
  }

  @Override
  public Integer executeUpdate() {
    try {
      int n = ps.executeUpdate();
      return (n < 0) ? null : n;
    } catch (SQLException e) {
      throw new UncheckedSqlException(commandText, e);
    }
  }

  @Override
  public void cancel() {
    try {
      ps.cancel();
    } catch (SQLException e) {
      throw new UncheckedSqlException(commandText, e);
    }
  }

  @Override
  public void close() {
    SQLException failure = null;
    try {
      ps.close();
    } catch (SQLException e) {
      failure = e;
    }
    if (ownsConnection) {
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure == null) failure = e; else failure.addSuppressed(e);
      }
    }
    if (failure != null) throw new UncheckedSqlException(commandText, failure);
  }

  private static PreparedStatement prepare(Connection c, String commandText, CommandType type, int parameterCount)
      throws SQLException {
    return switch (type) {
      case TEXT -> c.prepareStatement(commandText);
      case STORED_PROCEDURE -> c.prepareCall(callSyntax(commandText, parameterCount));
      case TABLE_DIRECT -> c.prepareStatement("SELECT * FROM " + commandText);
    };
  }

  static String callSyntax(String procedureName, int parameterCount) {
    StringBuilder sb = new StringBuilder("{call ").append(procedureName).append('(');
    for (int i = 0; i < parameterCount; i++) {
      if (i > 0) sb.append(", ");
      sb.append('?');
    }
    return sb.append(")}").toString();
  }

  private static void bindAll(PreparedStatement ps, List<CommandParameter> parameters) throws SQLException {
    for (int i = 0; i < parameters.size(); i++) {
      CommandParameter p = parameters.get(i);
      int pos = i + 1;
      Object v = p.value();
      if (v == null) {
        if (p.sqlType() != null) ps.setNull(pos, p.sqlType());
        else ps.setObject(pos, null);
      } else if (p.sqlType() != null) {
        ps.setObject(pos, toJdbcValue(v), p.sqlType());
      } else {
        ps.setObject(pos, toJdbcValue(v));
      }
    }
  }

  /** Values the driver may not know how to send. */
  static Object toJdbcValue(Object v) {
    if (v instanceof Enum<?> e) return e.name();
    if (v instanceof UUID u) return u.toString();
    if (v instanceof Character c) return c.toString();
    return v;
  }

  private void closeQuietly(PreparedStatement prepared) {
    try {
      if (prepared != null) prepared.close();
    } catch (SQLException e) {
      log.warn("sqlchain.jdbc close_failed sql={}", commandText, e);
    }
    if (!ownsConnection) return;
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("sqlchain.jdbc close_failed sql={}", commandText, e);
    }
  }
}
