package io.intellixity.sqlchain.jdbc;

import java.sql.SQLException;

/**
 * A driver {@link SQLException} carried as an unchecked exception, with the statement that raised it.
 */
public final class UncheckedSqlException extends RuntimeException {
  private final String commandText;

  public UncheckedSqlException(String commandText, SQLException cause) {
    super(message(commandText, cause), cause);
    this.commandText = commandText;
  }

  /** Statement text, or {@code null} when the failure was not tied to a statement (connect, commit). */
  public String commandText() { return commandText; }

  public String sqlState() {
    return ((SQLException) getCause()).getSQLState();
  }

  public int errorCode() {
    return ((SQLException) getCause()).getErrorCode();
  }

  private static String message(String commandText, SQLException cause) {
    String base = cause.getMessage() + " (sqlState=" + cause.getSQLState() + ")";
    return (commandText == null) ? base : base + " executing: " + commandText;
  }
}
