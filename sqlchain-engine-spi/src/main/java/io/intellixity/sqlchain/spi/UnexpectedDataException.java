package io.intellixity.sqlchain.spi;

/** A single-row read found more than one row. */
public final class UnexpectedDataException extends RuntimeException {
  public UnexpectedDataException(String message) {
    super(message);
  }
}
