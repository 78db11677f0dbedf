package io.intellixity.sqlchain.spi;

/** An asynchronous execution was canceled; the cause is the driver's failure, if any. */
public final class OperationCanceledException extends RuntimeException {
  public OperationCanceledException(String message) {
    super(message);
  }

  public OperationCanceledException(String message, Throwable cause) {
    super(message, cause);
  }
}
