package io.intellixity.sqlchain.spi;

/** Lock taken by a transactional context while a token runs. */
public enum LockMode {
  /** Shared with other readers. */
  READ,
  /** Exclusive. */
  WRITE,
  /** No lock; the transport serializes on its own. */
  NONE;

  /** The stronger of two modes. */
  public LockMode max(LockMode other) {
    if (this == WRITE || other == WRITE) return WRITE;
    if (this == READ || other == READ) return READ;
    return NONE;
  }
}
