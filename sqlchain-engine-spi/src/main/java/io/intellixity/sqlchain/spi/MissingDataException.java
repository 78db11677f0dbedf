package io.intellixity.sqlchain.spi;

/** A single-row read found no row. */
public final class MissingDataException extends RuntimeException {
  public MissingDataException(String message) {
    super(message);
  }
}
