package io.intellixity.sqlchain.op;

/** Paging strategy for a select. */
public enum LimitOptions {
  NONE,
  /** Offset-based: skip then take. */
  ROWS,
  /** Take only; skipping is not supported. */
  TOP,
  /** Take a random sample. A seed makes the ordering repeatable; skipping is not supported. */
  RANDOM_SAMPLE_ROWS
}
