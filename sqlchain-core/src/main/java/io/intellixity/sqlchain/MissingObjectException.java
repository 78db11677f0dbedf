package io.intellixity.sqlchain;

/** A table, view or procedure could not be found in the database catalog. */
public final class MissingObjectException extends RuntimeException {
  private final String objectName;

  public MissingObjectException(String objectName, String message) {
    super(message);
    this.objectName = objectName;
  }

  public String objectName() {
    return objectName;
  }
}
