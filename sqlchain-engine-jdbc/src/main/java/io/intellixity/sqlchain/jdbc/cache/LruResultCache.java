package io.intellixity.sqlchain.jdbc.cache;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Synchronized result cache bounded by entry count.\n
 *
 * - eviction: least recently read or written entry first\n
 * - expiry: per entry, measured from the write\n
 */
public final class LruResultCache implements ResultCache {
  public static final int DEFAULT_MAX_ENTRIES = 1_000;

  private final int maxEntries;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(Object value, long expiresAt) {
    boolean expired(long now) {
      return expiresAt > 0 && now >= expiresAt;
    }
  }

  public LruResultCache() {
    this(DEFAULT_MAX_ENTRIES, System::currentTimeMillis);
  }

  public LruResultCache(int maxEntries, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    this.maxEntries = maxEntries;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  @Override
  public synchronized Optional<Object> get(String key) {
    Objects.requireNonNull(key, "key");
    Entry e = entries.get(key);
    if (e == null) return Optional.empty();
    if (e.expired(nowMillis.getAsLong())) {
      entries.remove(key);
      return Optional.empty();
    }
    return Optional.of(e.value());
  }

  @Override
  public synchronized void put(String key, Object value, Duration timeToLive) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      entries.remove(key);
      return;
    }
    if (timeToLive != null && (timeToLive.isNegative() || timeToLive.isZero())) {
      throw new IllegalArgumentException("timeToLive must be positive");
    }
    long now = nowMillis.getAsLong();
    entries.put(key, new Entry(value, timeToLive == null ? 0 : now + timeToLive.toMillis()));
    pruneExpired(now);
    Iterator<String> eldest = entries.keySet().iterator();
    while (entries.size() > maxEntries && eldest.hasNext()) {
      eldest.next();
      eldest.remove();
    }
  }

  @Override
  public synchronized void invalidate(String key) {
    entries.remove(Objects.requireNonNull(key, "key"));
  }

  @Override
  public synchronized void clear() {
    entries.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return entries.size();
  }

  private void pruneExpired(long now) {
    entries.values().removeIf(e -> e.expired(now));
  }
}
