package io.intellixity.sqlchain.jdbc.materialize;

public enum DictionaryOptions {
  /** Keep the first row for a key and skip later rows with the same key, instead of failing. */
  DISCARD_DUPLICATES
}
