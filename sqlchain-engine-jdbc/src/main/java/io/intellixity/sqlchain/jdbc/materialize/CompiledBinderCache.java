package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.util.Lazy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Append-only cache of binders, one per {@link BinderKey}.\n
 *
 * Concurrent requests for a missing key compile once; every caller receives the same binder. A failed
 * compilation is reported to listeners and the key is served by the interpreted fallback from then on.
 */
public final class CompiledBinderCache {
  private static final Logger log = LoggerFactory.getLogger(CompiledBinderCache.class);

  private final ConcurrentHashMap<BinderKey, Lazy<RowBinder<?>>> binders = new ConcurrentHashMap<>();
  private final List<MaterializerListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(MaterializerListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(MaterializerListener listener) {
    listeners.remove(listener);
  }

  @SuppressWarnings("unchecked")
  public <T> RowBinder<T> getOrCompile(BinderKey key, Supplier<? extends RowBinder<T>> compiler,
                                       Supplier<? extends RowBinder<T>> fallback) {
    Objects.requireNonNull(key, "key");
    Lazy<RowBinder<?>> holder = binders.computeIfAbsent(key, k -> new Lazy<>(() -> compile(k, compiler, fallback)));
    return (RowBinder<T>) holder.get();
  }

  public int size() {
    return binders.size();
  }

  public boolean contains(BinderKey key) {
    Lazy<RowBinder<?>> holder = binders.get(key);
    return holder != null && holder.isDone();
  }

  private <T> RowBinder<?> compile(BinderKey key, Supplier<? extends RowBinder<T>> compiler,
                                   Supplier<? extends RowBinder<T>> fallback) {
    long start = System.nanoTime();
    try {
      RowBinder<T> binder = compiler.get();
      long took = System.nanoTime() - start;
      if (log.isDebugEnabled()) {
        log.debug("sqlchain.binder op=compile type={} durationMs={} sql={}",
            key.type().getName(), took / 1_000_000.0, key.commandText());
      }
      for (MaterializerListener l : listeners) l.onCompiled(key, took);
      return binder;
    } catch (RuntimeException e) {
      log.warn("sqlchain.binder op=compile_failed type={} sql={} fallback=interpreted",
          key.type().getName(), key.commandText(), e);
      for (MaterializerListener l : listeners) l.onCompileFailed(key, e);
      return fallback.get();
    }
  }
}
