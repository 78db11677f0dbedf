package io.intellixity.sqlchain.spi;

/**
 * The database changed a different number of rows than expected.\n
 * Raised after the statement ran; nothing is rolled back here.
 */
public final class RowCountMismatchException extends RuntimeException {
  private final int expected;
  private final Integer actual;

  public RowCountMismatchException(int expected, Integer actual, String commandText) {
    super("Expected " + expected + " row(s) to be affected but " + (actual == null ? "no count was reported" : actual)
        + ". Command: " + commandText);
    this.expected = expected;
    this.actual = actual;
  }

  public int expected() { return expected; }

  public Integer actual() { return actual; }
}
