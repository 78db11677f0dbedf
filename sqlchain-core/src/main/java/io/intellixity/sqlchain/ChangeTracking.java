package io.intellixity.sqlchain;

/**
 * Implemented by objects that track their own modifications.\n
 * Materializers call {@link #acceptChanges()} after populating a fresh instance so it starts out unchanged.
 */
public interface ChangeTracking {
  boolean isChanged();

  void acceptChanges();
}
