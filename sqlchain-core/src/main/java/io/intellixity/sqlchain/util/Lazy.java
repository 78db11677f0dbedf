package io.intellixity.sqlchain.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-safe, compute-once holder.\n
 *
 * The supplier runs at most once; every caller observes the same value, or the same failure.\n
 * {@code null} results are cached like any other value.
 */
public final class Lazy<T> implements Supplier<T> {
  private Supplier<? extends T> supplier;
  private volatile boolean done;
  private T value;
  private RuntimeException failure;

  public Lazy(Supplier<? extends T> supplier) {
    this.supplier = Objects.requireNonNull(supplier, "supplier");
  }

  @Override
  public T get() {
    if (!done) {
      synchronized (this) {
        if (!done) {
          try {
            value = supplier.get();
          } catch (RuntimeException e) {
            failure = e;
          }
          supplier = null;
          done = true;
        }
      }
    }
    if (failure != null) throw failure;
    return value;
  }

  public boolean isDone() {
    return done;
  }

  /** True once the supplier has run and thrown. */
  public boolean hasFailed() {
    return done && failure != null;
  }
}
