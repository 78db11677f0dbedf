package io.intellixity.sqlchain.op;

public enum DeleteOptions {
  /** Match rows on {@code @Key} properties instead of the table's primary key. */
  USE_KEY_ATTRIBUTE,
  /** Skip the affected-row check of deletes by key. */
  IGNORE_ROWS_AFFECTED
}
