package io.intellixity.sqlchain.jdbc.sqlite;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.LimitOptions;
import io.intellixity.sqlchain.op.Limits;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.NativeCommandFactory;

import java.util.List;

/**
 * SQLite dialect.\n
 *
 * Paging is {@code LIMIT/OFFSET}. Random samples order by {@code RANDOM()}, or by a hash of the rowid when
 * a seed is given so the same seed returns the same rows.
 */
public final class SqliteDialect extends AbstractSqlDialect<String> {
  @Override public String id() { return "sqlite"; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String quoteObjectName(String name) {
    return quoteIdent(name);
  }

  @Override
  public DatabaseMetadataCache<String> newMetadataCache(NativeCommandFactory commands, ClassMetadataCache types) {
    return new SqliteMetadataCache(commands, types, this);
  }

  @Override
  protected void applyLimits(SelectSql select, Limits limits, TableOrViewMetadata<String> table) {
    if (limits.options() == LimitOptions.RANDOM_SAMPLE_ROWS) {
      requireNoSortForSampling(select);
      if (limits.seed() == null) {
        select.orderBy("RANDOM()");
      } else {
        if (!table.isTable()) {
          throw new IllegalArgumentException("Seeded random sampling needs a rowid; " + table.name() + " is a view");
        }
        select.orderBy(seededOrder(limits.seed()));
      }
      select.suffix(" LIMIT " + limits.take());
      return;
    }
    // TOP and ROWS are the same thing here
    String suffix = " LIMIT " + (limits.take() == null ? -1 : limits.take());
    if (limits.skip() != null) suffix += " OFFSET " + limits.skip();
    select.suffix(suffix);
  }

  private static final long MODULUS = 2147483647L;

  /**
   * Two rounds of xor then multiply modulo 2^31 - 1, with the mask and multiplier of each round derived from
   * the seed. Intermediates stay below 2^62 so SQLite keeps integer arithmetic. SQLite has no XOR operator;
   * {@code a ^ b} is written {@code (a | b) - (a & b)}.
   */
  static String seededOrder(int seed) {
    String x = "rowid";
    long h = seed + 0x9E3779B97F4A7C15L;
    for (int round = 0; round < 2; round++) {
      h = mix(h);
      long mask = h >>> 33;
      long multiplier = (h & 0x7FFFFFFFL) % (MODULUS - 1) + 1;
      x = "(((" + x + " | " + mask + ") - (" + x + " & " + mask + ")) % " + MODULUS
          + " * " + multiplier + " % " + MODULUS + ")";
    }
    return x;
  }

  // murmur3 64-bit finalizer
  private static long mix(long z) {
    z ^= z >>> 33;
    z *= 0xff51afd7ed558ccdL;
    z ^= z >>> 33;
    z *= 0xc4ceb9fe1a85ec53L;
    z ^= z >>> 33;
    return z;
  }

  @Override
  public Rendered renderUpsert(TableOrViewMetadata<String> table, List<ColumnValue> keys, List<ColumnValue> values,
                               List<ColumnMetadata> output) {
    return renderInsertOnConflict(table, keys, values, output);
  }

  @Override
  protected String returningClause(List<ColumnMetadata> output) {
    return returningList(output);
  }
}
