package io.intellixity.sqlchain.metadata;

import io.intellixity.sqlchain.MissingObjectException;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.util.Lazy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-data-source catalog of tables and views.\n
 *
 * Discovery runs at most once per name, including when the object turns out not to exist.\n
 * Entries are never evicted. A discovery that throws is not cached; the next lookup of that name retries it.
 *
 * @param <N> the dialect's object name type
 */
public abstract class DatabaseMetadataCache<N> {
  private static final Logger log = LoggerFactory.getLogger(DatabaseMetadataCache.class);

  private final ConcurrentHashMap<N, Lazy<TableOrViewMetadata<N>>> tables = new ConcurrentHashMap<>();
  private final ClassMetadataCache types;

  protected DatabaseMetadataCache() {
    this(new ClassMetadataCache());
  }

  protected DatabaseMetadataCache(ClassMetadataCache types) {
    this.types = Objects.requireNonNull(types, "types");
  }

  public final ClassMetadataCache types() {
    return types;
  }

  /**
   * Metadata for a table or view.\n
   * Soft-introspection dialects return {@code null} for unknown names; strict ones throw {@link MissingObjectException}.
   */
  public TableOrViewMetadata<N> getTableOrView(N name) {
    TableOrViewMetadata<N> found = tryGetTableOrView(name);
    if (found == null && strictIntrospection()) {
      throw new MissingObjectException(String.valueOf(name), "Could not find table or view " + name);
    }
    return found;
  }

  /** Metadata for a table or view, or {@code null} when it does not exist. */
  public final TableOrViewMetadata<N> tryGetTableOrView(N name) {
    Objects.requireNonNull(name, "name");
    N key = normalize(name);
    return getOrDiscover(tables, key, this::discover);
  }

  /**
   * Cached value for {@code key}, discovered once under contention. A failed discovery is removed so that a
   * later call runs it again; callers already waiting on it see the same failure.
   */
  protected static <K, V> V getOrDiscover(ConcurrentHashMap<K, Lazy<V>> cache, K key, Function<K, V> discovery) {
    Lazy<V> holder = cache.computeIfAbsent(key, k -> new Lazy<>(() -> discovery.apply(k)));
    try {
      return holder.get();
    } catch (RuntimeException e) {
      cache.remove(key, holder);
      throw e;
    }
  }

  /** Stored procedure metadata, or {@code null} when the dialect has none or it does not exist. */
  public StoredProcedureMetadata<N> getStoredProcedure(N name) {
    return null;
  }

  /** Table-valued function metadata, or {@code null} when the dialect has none or it does not exist. */
  public TableOrViewMetadata<N> getTableFunction(N name) {
    return null;
  }

  /** Discovers every table so later lookups are served from the cache. */
  public final void preloadTables() {
    for (N name : listTableNames()) tryGetTableOrView(name);
  }

  public final void preloadViews() {
    for (N name : listViewNames()) tryGetTableOrView(name);
  }

  /** Snapshot of the tables and views discovered so far, unknown names excluded. */
  public final List<TableOrViewMetadata<N>> cachedTablesAndViews() {
    List<TableOrViewMetadata<N>> out = new ArrayList<>();
    for (Lazy<TableOrViewMetadata<N>> l : tables.values()) {
      if (!l.isDone() || l.hasFailed()) continue;
      TableOrViewMetadata<N> t = l.get();
      if (t != null) out.add(t);
    }
    return out;
  }

  public abstract N parseObjectName(String name);

  /** Whether an unknown name is an error ({@code true}) or a {@code null} result. */
  protected abstract boolean strictIntrospection();

  /** Catalog query for one object; {@code null} when it does not exist. */
  protected abstract TableOrViewMetadata<N> discoverTableOrView(N name);

  protected abstract List<N> listTableNames();

  protected abstract List<N> listViewNames();

  /** Cache key form of a name. Default: unchanged. */
  protected N normalize(N name) {
    return name;
  }

  protected final TableOrViewMetadata<N> newTableOrView(N name, boolean isTable, List<ColumnMetadata> columns) {
    return new TableOrViewMetadata<>(name, isTable, columns, types);
  }

  private TableOrViewMetadata<N> discover(N name) {
    long start = System.nanoTime();
    TableOrViewMetadata<N> t = discoverTableOrView(name);
    if (log.isDebugEnabled()) {
      log.debug("sqlchain.metadata op=discover name={} found={} columns={} durationMs={}",
          name, t != null, t == null ? 0 : t.columns().size(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return t;
  }
}
