package io.intellixity.sqlchain.spi;

public enum CommandType {
  TEXT,
  STORED_PROCEDURE,
  TABLE_DIRECT
}
