package io.intellixity.sqlchain.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Behaviour switches of a data source.
 *
 * @param strictMode              unknown desired columns and unmapped write properties fail instead of being ignored
 * @param defaultCommandTimeout   timeout for commands that do not set one, {@code null} for the driver default
 * @param disableLocks            transactional contexts skip their reader/writer lock
 * @param useCompiledMaterializers bind rows through compiled binders instead of per-row lookups
 */
public record DataSourceSettings(boolean strictMode, Duration defaultCommandTimeout, boolean disableLocks,
                                 boolean useCompiledMaterializers) {
  public static final String STRICT_MODE = "sqlchain.strictMode";
  public static final String DEFAULT_COMMAND_TIMEOUT_SECONDS = "sqlchain.defaultCommandTimeoutSeconds";
  public static final String DISABLE_LOCKS = "sqlchain.disableLocks";
  public static final String COMPILED_MATERIALIZERS = "sqlchain.compiledMaterializers";

  public static final DataSourceSettings DEFAULTS = new DataSourceSettings(false, null, false, true);

  public DataSourceSettings {
    if (defaultCommandTimeout != null && (defaultCommandTimeout.isNegative() || defaultCommandTimeout.isZero())) {
      throw new IllegalArgumentException("defaultCommandTimeout must be positive: " + defaultCommandTimeout);
    }
  }

  public DataSourceSettings withStrictMode(boolean v) {
    return new DataSourceSettings(v, defaultCommandTimeout, disableLocks, useCompiledMaterializers);
  }

  public DataSourceSettings withDefaultCommandTimeout(Duration v) {
    return new DataSourceSettings(strictMode, v, disableLocks, useCompiledMaterializers);
  }

  public DataSourceSettings withDisableLocks(boolean v) {
    return new DataSourceSettings(strictMode, defaultCommandTimeout, v, useCompiledMaterializers);
  }

  public DataSourceSettings withUseCompiledMaterializers(boolean v) {
    return new DataSourceSettings(strictMode, defaultCommandTimeout, disableLocks, v);
  }

  /** Reads {@code sqlchain.*} keys; absent keys keep their {@link #DEFAULTS} value. */
  public static DataSourceSettings fromProperties(Properties p) {
    DataSourceSettings d = DEFAULTS;
    String timeout = trimmed(p.getProperty(DEFAULT_COMMAND_TIMEOUT_SECONDS));
    Duration t = d.defaultCommandTimeout();
    if (timeout != null) {
      try {
        t = Duration.ofSeconds(Long.parseLong(timeout));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + DEFAULT_COMMAND_TIMEOUT_SECONDS + ": " + timeout, e);
      }
    }
    return new DataSourceSettings(
        bool(p, STRICT_MODE, d.strictMode()),
        t,
        bool(p, DISABLE_LOCKS, d.disableLocks()),
        bool(p, COMPILED_MATERIALIZERS, d.useCompiledMaterializers()));
  }

  /** Loads a properties file from the classpath, e.g. {@code sqlchain.properties}. */
  public static DataSourceSettings fromClasspath(String resource) {
    Properties p = new Properties();
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = DataSourceSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Settings resource not found: " + resource);
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
    return fromProperties(p);
  }

  private static boolean bool(Properties p, String key, boolean dflt) {
    String v = trimmed(p.getProperty(key));
    if (v == null) return dflt;
    if ("true".equalsIgnoreCase(v)) return true;
    if ("false".equalsIgnoreCase(v)) return false;
    throw new IllegalArgumentException("Invalid " + key + ": " + v);
  }

  private static String trimmed(String v) {
    if (v == null) return null;
    String t = v.trim();
    return t.isEmpty() ? null : t;
  }
}
