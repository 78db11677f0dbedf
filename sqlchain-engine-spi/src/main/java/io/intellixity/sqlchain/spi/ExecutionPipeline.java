package io.intellixity.sqlchain.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;

/**
 * Runs execution token chains against native commands.\n
 *
 * Responsibilities:\n
 * - Execute each token of a chain in order, row tokens into the materializer, others with their row-count check\n
 * - Take the lock the chain asks for, through {@link #lockFor(LockMode)}\n
 * - Offer the same execution synchronously and on an {@link Executor}\n
 *
 * The synchronous path surfaces driver failures unchanged. The asynchronous path turns any failure that follows
 * a cancellation into {@link OperationCanceledException}.
 */
public abstract class ExecutionPipeline {
  private static final Logger log = LoggerFactory.getLogger(ExecutionPipeline.class);

  private final Executor asyncExecutor;

  protected ExecutionPipeline(Executor asyncExecutor) {
    this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
  }

  /** Command source for the next execution. */
  protected abstract NativeCommandFactory commands();

  /** Timeout for tokens that do not carry one; {@code null} means the driver default. */
  protected Duration defaultCommandTimeout() {
    return null;
  }

  /** Lock guarding a chain of the given mode, or {@code null} for none. Default: no locking. */
  protected Lock lockFor(LockMode mode) {
    return null;
  }

  /** Fails when this pipeline can no longer execute. Default: always usable. */
  protected void ensureUsable() {
  }

  public final <R> R execute(ExecutionToken token, Materializer<R> materializer) {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(materializer, "materializer");
    ensureUsable();
    return runChain(token, materializer, null);
  }

  public final <R> CompletableFuture<R> executeAsync(ExecutionToken token, Materializer<R> materializer) {
    return executeAsync(token, materializer, new CancellationSignal());
  }

  /**
   * Executes on the async executor. Cancelling the returned future also cancels {@code signal}.
   */
  public final <R> CompletableFuture<R> executeAsync(ExecutionToken token, Materializer<R> materializer,
                                                     CancellationSignal signal) {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(materializer, "materializer");
    Objects.requireNonNull(signal, "signal");
    ensureUsable();
    if (signal.isCancelled()) {
      return CompletableFuture.failedFuture(new OperationCanceledException("Canceled before execution: " + token.operation()));
    }

    CompletableFuture<R> result = new CompletableFuture<>();
    result.whenComplete((r, ex) -> {
      if (result.isCancelled()) signal.cancel();
    });
    asyncExecutor.execute(() -> {
      try {
        result.complete(runChain(token, materializer, signal));
      } catch (Throwable e) {
        if (signal.isCancelled() && e instanceof RuntimeException && !(e instanceof OperationCanceledException)) {
          result.completeExceptionally(new OperationCanceledException("Operation was canceled: " + token.operation(), e));
        } else {
          result.completeExceptionally(e);
        }
      }
    });
    return result;
  }

  private <R> R runChain(ExecutionToken token, Materializer<R> materializer, CancellationSignal signal) {
    Lock lock = lockFor(token.chainLockMode());
    if (lock != null) lock.lock();
    try {
      // the pipeline may have been finished while this chain waited for the lock
      ensureUsable();
      R rows = null;
      boolean haveRows = false;
      Integer lastCount = null;
      for (ExecutionToken t : token.chain()) {
        if (signal != null && signal.isCancelled()) {
          throw new OperationCanceledException("Operation was canceled: " + t.operation());
        }
        Duration timeout = (t.timeout() != null) ? t.timeout() : defaultCommandTimeout();
        long start = System.nanoTime();
        debugStart(t);
        try (NativeCommand cmd = commands().create(t.commandText(), t.commandType(), t.parameters(), timeout);
             CancellationSignal.Registration ignored = register(signal, cmd)) {
          if (t.returnsRows()) {
            try (RowCursor cursor = cmd.executeQuery()) {
              rows = materializer.fromRows(t, cursor);
            }
            haveRows = true;
            debugDone(t, "rows", start);
          } else {
            Integer n = cmd.executeUpdate();
            debugDone(t, n, start);
            t.checkAffectedRowCount(n);
            lastCount = n;
          }
        }
      }
      return haveRows ? rows : materializer.fromRowsAffected(lastCount);
    } finally {
      if (lock != null) lock.unlock();
    }
  }

  private static CancellationSignal.Registration register(CancellationSignal signal, NativeCommand cmd) {
    if (signal == null) return () -> {};
    return signal.onCancel(cmd::cancel);
  }

  private static void debugStart(ExecutionToken t) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlchain.exec op={} returnsRows={} paramCount={} lock={} sql={}",
        t.operation(), t.returnsRows(), t.parameters().size(), t.lockMode(), t.commandText());

    // TRACE: parameter summary only, no raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (CommandParameter p : t.parameters()) {
        Object v = p.value();
        log.trace("sqlchain.exec param index={} name={} valueType={}",
            idx++, p.name(), v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(ExecutionToken t, Object result, long startNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlchain.exec_done op={} durationMs={} result={}",
        t.operation(), (System.nanoTime() - startNanos) / 1_000_000.0, result);
  }
}
