package io.intellixity.sqlchain.jdbc.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Store for materialized operation results, keyed by caller-chosen strings.\n
 * {@code null} results are never stored.
 */
public interface ResultCache {
  Optional<Object> get(String key);

  /** Stores {@code value} under {@code key}; {@code timeToLive} of {@code null} keeps it until evicted. */
  void put(String key, Object value, Duration timeToLive);

  void invalidate(String key);

  void clear();
}
