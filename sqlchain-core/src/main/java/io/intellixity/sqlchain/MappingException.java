package io.intellixity.sqlchain;

/**
 * Raised when columns, properties or constructors cannot be matched between a table and a type.\n
 * Never retried; the descriptor or the type has to change.
 */
public final class MappingException extends RuntimeException {
  public MappingException(String message) {
    super(message);
  }

  public MappingException(String message, Throwable cause) {
    super(message, cause);
  }
}
