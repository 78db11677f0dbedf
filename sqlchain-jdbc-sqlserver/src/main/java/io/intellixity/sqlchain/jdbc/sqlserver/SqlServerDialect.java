package io.intellixity.sqlchain.jdbc.sqlserver;

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
 * SQL Server dialect.\n
 *
 * Paging:\n
 * - take only, or {@link LimitOptions#TOP}: {@code SELECT TOP (n)}\n
 * - skip: {@code OFFSET n ROWS [FETCH NEXT m ROWS ONLY]}, which SQL Server only accepts after an ORDER BY\n
 * - random sample: {@code TABLESAMPLE SYSTEM (n ROWS) [REPEATABLE (seed)]} capped by {@code TOP (n)}, tables only\n
 *
 * Inserts return columns through {@code OUTPUT Inserted.*}; upserts are a single {@code MERGE}.
 */
public final class SqlServerDialect extends AbstractSqlDialect<SqlServerObjectName> {
  @Override public String id() { return "sqlserver"; }

  @Override
  public String quoteIdent(String ident) {
    return "[" + ident.replace("]", "]]") + "]";
  }

  @Override
  public String quoteObjectName(SqlServerObjectName name) {
    return quoteIdent(name.schema()) + "." + quoteIdent(name.name());
  }

  @Override
  public DatabaseMetadataCache<SqlServerObjectName> newMetadataCache(NativeCommandFactory commands,
                                                                     ClassMetadataCache types) {
    return new SqlServerMetadataCache(commands, types, this);
  }

  @Override
  protected void applyLimits(SelectSql select, Limits limits, TableOrViewMetadata<SqlServerObjectName> table) {
    if (limits.options() == LimitOptions.RANDOM_SAMPLE_ROWS) {
      if (!table.isTable()) {
        throw new IllegalArgumentException("TABLESAMPLE needs a table; " + table.name() + " is a view");
      }
      select.top("TOP (" + limits.take() + ") ");
      select.tableSample(" TABLESAMPLE SYSTEM (" + limits.take() + " ROWS)"
          + (limits.seed() == null ? "" : " REPEATABLE (" + limits.seed() + ")"));
      return;
    }
    if (limits.skip() == null) {
      if (limits.take() != null) select.top("TOP (" + limits.take() + ") ");
      return;
    }
    if (!select.hasOrderBy()) {
      throw new IllegalArgumentException("Skip needs a sort order on dialect: " + id());
    }
    String suffix = " OFFSET " + limits.skip() + " ROWS";
    if (limits.take() != null) suffix += " FETCH NEXT " + limits.take() + " ROWS ONLY";
    select.suffix(suffix);
  }

  @Override
  protected String insertOutputClause(List<ColumnMetadata> output) {
    return outputList(output);
  }

  @Override
  public Rendered renderUpsert(TableOrViewMetadata<SqlServerObjectName> table, List<ColumnValue> keys,
                               List<ColumnValue> values, List<ColumnMetadata> output) {
    if (keys.isEmpty()) throw new IllegalArgumentException("Upsert has no match columns on " + table.name());
    RenderCtx ctx = new RenderCtx();
    List<String> sourceCols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    List<String> on = new ArrayList<>();
    List<String> sets = new ArrayList<>();
    List<String> insertCols = new ArrayList<>();
    List<String> insertValues = new ArrayList<>();

    for (ColumnValue k : keys) {
      String c = k.column().quotedSqlName();
      sourceCols.add(c);
      ph.add(ctx.add(k.column().clrName(), k.value()));
      on.add("target." + c + " = source." + c);
      // identity keys are generated on insert
      if (k.column().updatable()) {
        insertCols.add(c);
        insertValues.add("source." + c);
      }
    }
    for (ColumnValue v : values) {
      String c = v.column().quotedSqlName();
      sourceCols.add(c);
      ph.add(ctx.add(v.column().clrName(), v.value()));
      sets.add("target." + c + " = source." + c);
      insertCols.add(c);
      insertValues.add("source." + c);
    }

    StringBuilder sql = new StringBuilder("MERGE INTO ").append(quoteObjectName(table.name()))
        .append(" WITH (HOLDLOCK) AS target USING (VALUES (").append(join(ph)).append(")) AS source (")
        .append(join(sourceCols)).append(") ON ").append(String.join(" AND ", on));
    if (!sets.isEmpty()) sql.append(" WHEN MATCHED THEN UPDATE SET ").append(join(sets));
    sql.append(" WHEN NOT MATCHED THEN INSERT ");
    if (insertCols.isEmpty()) {
      sql.append("DEFAULT VALUES");
    } else {
      sql.append('(').append(join(insertCols)).append(") VALUES (").append(join(insertValues)).append(')');
    }
    sql.append(outputList(output)).append(';');
    return new Rendered(sql.toString(), ctx.params());
  }

  private static String outputList(List<ColumnMetadata> output) {
    if (output == null || output.isEmpty()) return "";
    List<String> cols = new ArrayList<>();
    for (ColumnMetadata c : output) cols.add("Inserted." + c.quotedSqlName());
    return " OUTPUT " + join(cols);
  }
}
