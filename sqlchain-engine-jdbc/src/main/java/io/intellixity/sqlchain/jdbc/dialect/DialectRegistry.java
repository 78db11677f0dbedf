package io.intellixity.sqlchain.jdbc.dialect;

import io.intellixity.sqlchain.util.SqlchainFactoriesLoader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dialects by id, built via discovery (META-INF/sqlchain.factories).\n
 *
 * Resolution semantics:\n
 * - Ids are matched ignoring case.\n
 * - When two providers claim an id, the first on the classpath wins.\n
 */
public final class DialectRegistry {
  private final Map<String, SqlDialectProvider> providers;

  public DialectRegistry() {
    this(SqlchainFactoriesLoader.load(SqlDialectProvider.class));
  }

  public DialectRegistry(List<SqlDialectProvider> providers) {
    Map<String, SqlDialectProvider> byId = new LinkedHashMap<>();
    for (SqlDialectProvider p : providers) {
      if (p == null) continue;
      byId.putIfAbsent(normalize(p.id()), p);
    }
    this.providers = Collections.unmodifiableMap(byId);
  }

  public Set<String> ids() {
    return providers.keySet();
  }

  /** A new dialect instance for {@code id}. */
  public AbstractSqlDialect<?> dialect(String id) {
    SqlDialectProvider p = providers.get(normalize(id));
    if (p == null) {
      throw new IllegalArgumentException("No dialect registered for id=" + id + ", known=" + providers.keySet());
    }
    return p.create();
  }

  private static String normalize(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("dialect id is required");
    return id.trim().toLowerCase(Locale.ROOT);
  }
}
