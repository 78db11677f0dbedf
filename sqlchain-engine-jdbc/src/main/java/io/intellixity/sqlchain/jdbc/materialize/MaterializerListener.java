package io.intellixity.sqlchain.jdbc.materialize;

/** Observes binder compilation. Callbacks run on the compiling thread. */
public interface MaterializerListener {
  default void onCompiled(BinderKey key, long durationNanos) {}

  /** The interpreted binder is used for {@code key} from now on. */
  default void onCompileFailed(BinderKey key, RuntimeException error) {}
}
