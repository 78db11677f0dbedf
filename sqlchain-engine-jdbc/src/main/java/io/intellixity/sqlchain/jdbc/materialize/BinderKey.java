package io.intellixity.sqlchain.jdbc.materialize;

import java.util.Objects;

/**
 * Identity of a compiled binder: the statement that shapes the rows and the type they are bound to.
 *
 * @param constructorBound whether rows go through a constructor instead of setters
 */
public record BinderKey(String commandText, Class<?> type, boolean constructorBound) {
  public BinderKey {
    Objects.requireNonNull(commandText, "commandText");
    Objects.requireNonNull(type, "type");
  }
}
