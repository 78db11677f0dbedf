package io.intellixity.sqlchain.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One native connection and one native transaction, shared by every operation routed through it.\n
 *
 * Chains tagged {@link LockMode#WRITE} run exclusively, {@link LockMode#READ} chains share access,
 * {@link LockMode#NONE} chains bypass the lock. With {@code disableLocks} nothing is locked.\n
 * After {@link #commit()}, {@link #rollback()} or {@link #close()} every operation fails.
 */
public abstract class TransactionalContext extends ExecutionPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TransactionalContext.class);

  private final ReentrantReadWriteLock syncLock = new ReentrantReadWriteLock();
  private final boolean disableLocks;
  private final AtomicBoolean disposed = new AtomicBoolean();

  protected TransactionalContext(Executor asyncExecutor, boolean disableLocks) {
    super(asyncExecutor);
    this.disableLocks = disableLocks;
  }

  protected abstract void doCommit();

  protected abstract void doRollback();

  /** Releases the native connection. Called once. */
  protected abstract void doClose();

  public final boolean isDisposed() {
    return disposed.get();
  }

  public final boolean locksDisabled() {
    return disableLocks;
  }

  @Override
  protected final Lock lockFor(LockMode mode) {
    if (disableLocks) return null;
    return switch (mode) {
      case READ -> syncLock.readLock();
      case WRITE -> syncLock.writeLock();
      case NONE -> null;
    };
  }

  @Override
  protected final void ensureUsable() {
    if (disposed.get()) {
      throw new IllegalStateException(getClass().getSimpleName() + " has been disposed");
    }
  }

  public final void commit() {
    finish(true);
  }

  public final void rollback() {
    finish(false);
  }

  /** Rolls back when neither commit nor rollback ran, then releases the connection. Idempotent. */
  @Override
  public final void close() {
    if (disposed.get()) return;
    finish(false);
  }

  private void finish(boolean commit) {
    ensureUsable();
    Lock lock = lockFor(LockMode.WRITE);
    if (lock != null) lock.lock();
    try {
      if (!disposed.compareAndSet(false, true)) {
        throw new IllegalStateException(getClass().getSimpleName() + " has been disposed");
      }
      try {
        if (commit) doCommit();
        else doRollback();
        if (log.isDebugEnabled()) log.debug("sqlchain.tx op={} context={}", commit ? "commit" : "rollback", this);
      } finally {
        doClose();
      }
    } finally {
      if (lock != null) lock.unlock();
    }
  }
}
