package io.intellixity.sqlchain.spi;

/** One prepared native statement. Closing it releases every resource it holds. */
public interface NativeCommand extends AutoCloseable {
  RowCursor executeQuery();

  /** Affected rows, or {@code null} when the driver does not report a count. */
  Integer executeUpdate();

  /** Requests cancellation of a running execution. May be called from another thread. */
  void cancel();

  @Override
  void close();
}
