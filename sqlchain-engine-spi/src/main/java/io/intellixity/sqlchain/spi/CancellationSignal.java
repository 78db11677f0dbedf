package io.intellixity.sqlchain.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for asynchronous executions.\n
 * Callbacks registered while the signal is already canceled run immediately. Each callback runs at most once.
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final CopyOnWriteArrayList<Callback> callbacks = new CopyOnWriteArrayList<>();
  private volatile boolean cancelled;

  /** Removes a callback. */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public void cancel() {
    if (cancelled) return;
    cancelled = true;
    for (Callback c : callbacks) c.fire();
  }

  public Registration onCancel(Runnable callback) {
    Callback c = new Callback(callback);
    callbacks.add(c);
    // may race with cancel(); fire() runs the action once
    if (cancelled) c.fire();
    return () -> callbacks.remove(c);
  }

  private static final class Callback {
    private final Runnable action;
    private final AtomicBoolean fired = new AtomicBoolean();

    Callback(Runnable action) {
      this.action = action;
    }

    void fire() {
      if (!fired.compareAndSet(false, true)) return;
      try {
        action.run();
      } catch (RuntimeException e) {
        // the execution itself reports the failure
        log.warn("sqlchain.cancel callback failed: {}", e.toString());
      }
    }
  }
}
