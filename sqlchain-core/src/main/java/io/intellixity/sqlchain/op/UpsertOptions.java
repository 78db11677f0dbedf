package io.intellixity.sqlchain.op;

public enum UpsertOptions {
  /** Match rows on {@code @Key} properties instead of the table's primary key. */
  USE_KEY_ATTRIBUTE
}
