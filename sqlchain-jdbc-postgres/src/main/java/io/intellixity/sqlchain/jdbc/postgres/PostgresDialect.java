package io.intellixity.sqlchain.jdbc.postgres;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.LimitOptions;
import io.intellixity.sqlchain.op.Limits;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.NativeCommandFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * Keeps only Postgres-specific quoting, paging, RETURNING and upsert syntax.\n
 * Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect<PostgresObjectName> {
  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String quoteObjectName(PostgresObjectName name) {
    return quoteIdent(name.schema()) + "." + quoteIdent(name.name());
  }

  @Override
  public DatabaseMetadataCache<PostgresObjectName> newMetadataCache(NativeCommandFactory commands,
                                                                    ClassMetadataCache types) {
    return new PostgresMetadataCache(commands, types, this);
  }

  @Override
  protected void applyLimits(SelectSql select, Limits limits, TableOrViewMetadata<PostgresObjectName> table) {
    if (limits.options() == LimitOptions.RANDOM_SAMPLE_ROWS) {
      requireNoSortForSampling(select);
      select.orderBy(limits.seed() == null ? "random()" : seededOrder(table, limits.seed()));
      select.suffix(" LIMIT " + limits.take());
      return;
    }
    StringBuilder suffix = new StringBuilder();
    if (limits.take() != null) suffix.append(" LIMIT ").append(limits.take());
    if (limits.skip() != null) suffix.append(" OFFSET ").append(limits.skip());
    select.suffix(suffix.toString());
  }

  // hash of the key plus seed: same seed, same order
  private static String seededOrder(TableOrViewMetadata<PostgresObjectName> table, int seed) {
    List<ColumnMetadata> keys = table.primaryKeyColumns();
    if (keys.isEmpty()) {
      throw new IllegalArgumentException("Seeded random sampling needs a primary key; " + table.name() + " has none");
    }
    List<String> parts = new ArrayList<>();
    for (ColumnMetadata k : keys) parts.add(k.quotedSqlName());
    parts.add("'" + seed + "'");
    return "md5(concat(" + join(parts) + "))";
  }

  @Override
  public Rendered renderUpsert(TableOrViewMetadata<PostgresObjectName> table, List<ColumnValue> keys,
                               List<ColumnValue> values, List<ColumnMetadata> output) {
    return renderInsertOnConflict(table, keys, values, output);
  }

  @Override
  protected String returningClause(List<ColumnMetadata> output) {
    return returningList(output);
  }
}
