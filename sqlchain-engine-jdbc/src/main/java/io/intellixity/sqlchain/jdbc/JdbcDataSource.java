package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.jdbc.cache.LruResultCache;
import io.intellixity.sqlchain.jdbc.cache.ResultCache;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.jdbc.dialect.DialectRegistry;
import io.intellixity.sqlchain.jdbc.dialect.SqlCommandBuilder;
import io.intellixity.sqlchain.jdbc.materialize.CompiledBinderCache;
import io.intellixity.sqlchain.jdbc.materialize.Materializers;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.ExecutionPipeline;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Entry point over a JDBC {@link DataSource}.\n
 *
 * Owns the caches that live as long as the data source: type metadata, the database catalog, compiled
 * binders and cached results. Every command outside a transaction borrows its own connection and returns it when done.
 *
 * @param <N> the dialect's object name type
 */
public class JdbcDataSource<N> extends ExecutionPipeline implements SqlOperations<N> {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataSource.class);

  private final DataSource dataSource;
  private final AbstractSqlDialect<N> dialect;
  private final DataSourceSettings settings;
  private final Executor asyncExecutor;
  private final DatabaseMetadataCache<N> metadata;
  private final SqlCommandBuilder<N> builder;
  private final Materializers materializers;
  private final NativeCommandFactory commands;
  private final ResultCache resultCache;

  public JdbcDataSource(DataSource dataSource, AbstractSqlDialect<N> dialect, DataSourceSettings settings) {
    this(dataSource, dialect, settings, ForkJoinPool.commonPool());
  }

  public JdbcDataSource(DataSource dataSource, AbstractSqlDialect<N> dialect, DataSourceSettings settings,
                        Executor asyncExecutor) {
    this(dataSource, dialect, settings, asyncExecutor, new LruResultCache());
  }

  public JdbcDataSource(DataSource dataSource, AbstractSqlDialect<N> dialect, DataSourceSettings settings,
                        Executor asyncExecutor, ResultCache resultCache) {
    super(asyncExecutor);
    this.resultCache = Objects.requireNonNull(resultCache, "resultCache");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.settings = (settings == null) ? DataSourceSettings.DEFAULTS : settings;
    this.asyncExecutor = asyncExecutor;
    this.commands = (text, type, params, timeout) ->
        new JdbcNativeCommand(openConnection(), true, text, type, params, timeout);

    ClassMetadataCache types = new ClassMetadataCache();
    this.metadata = dialect.newMetadataCache(commands, types);
    this.builder = new SqlCommandBuilder<>(dialect, metadata, this.settings.strictMode());
    this.materializers = new Materializers(types, new CompiledBinderCache(), this.settings.useCompiledMaterializers());

    if (log.isDebugEnabled()) {
      log.debug("sqlchain.jdbc op=open dialect={} strict={} compiledMaterializers={} disableLocks={} timeout={}",
          dialect.id(), this.settings.strictMode(), this.settings.useCompiledMaterializers(),
          this.settings.disableLocks(), this.settings.defaultCommandTimeout());
    }
  }

  /** Data source for a dialect registered under {@code dialectId} in {@code META-INF/sqlchain.factories}. */
  public static JdbcDataSource<?> create(String dialectId, DataSource dataSource, DataSourceSettings settings) {
    return create(new DialectRegistry().dialect(dialectId), dataSource, settings);
  }

  private static <N> JdbcDataSource<N> create(AbstractSqlDialect<N> dialect, DataSource dataSource,
                                              DataSourceSettings settings) {
    return new JdbcDataSource<>(dataSource, dialect, settings);
  }

  public AbstractSqlDialect<N> dialect() { return dialect; }

  public DataSourceSettings settings() { return settings; }

  public DatabaseMetadataCache<N> metadata() { return metadata; }

  @Override
  public SqlCommandBuilder<N> builder() { return builder; }

  @Override
  public Materializers materializers() { return materializers; }

  @Override
  public ResultCache resultCache() { return resultCache; }

  @Override
  protected NativeCommandFactory commands() {
    return commands;
  }

  @Override
  protected Duration defaultCommandTimeout() {
    return settings.defaultCommandTimeout();
  }

  /** Opens a connection, starts a transaction on it and routes operations through it until finished. */
  public JdbcTransactionalDataSource<N> beginTransaction() {
    Connection c = openConnection();
    try {
      c.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        c.close();
      } catch (SQLException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw new UncheckedSqlException(null, e);
    }
    if (log.isDebugEnabled()) log.debug("sqlchain.tx op=begin dialect={}", dialect.id());
    return new JdbcTransactionalDataSource<>(this, c, asyncExecutor);
  }

  private Connection openConnection() {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw new UncheckedSqlException(null, e);
    }
  }
}
