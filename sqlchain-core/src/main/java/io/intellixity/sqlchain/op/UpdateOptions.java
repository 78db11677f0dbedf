package io.intellixity.sqlchain.op;

public enum UpdateOptions {
  /** Match rows on {@code @Key} properties instead of the table's primary key. */
  USE_KEY_ATTRIBUTE,
  /** Read rows back before the update instead of after it. */
  RETURN_OLD_VALUES,
  /** Skip the affected-row check of updates by key. */
  IGNORE_ROWS_AFFECTED
}
