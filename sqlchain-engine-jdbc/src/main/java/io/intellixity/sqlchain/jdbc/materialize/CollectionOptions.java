package io.intellixity.sqlchain.jdbc.materialize;

public enum CollectionOptions {
  /** Bind rows through the type's single non-default constructor; desired columns are its parameter names. */
  INFER_CONSTRUCTOR
}
