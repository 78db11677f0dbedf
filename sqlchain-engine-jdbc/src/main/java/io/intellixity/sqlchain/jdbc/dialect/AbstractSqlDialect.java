package io.intellixity.sqlchain.jdbc.dialect;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.jdbc.NamedParameterSql;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.FilterOptions;
import io.intellixity.sqlchain.op.LimitOptions;
import io.intellixity.sqlchain.op.Limits;
import io.intellixity.sqlchain.op.SortExpression;
import io.intellixity.sqlchain.op.TableFilter;
import io.intellixity.sqlchain.op.ValueFilter;
import io.intellixity.sqlchain.op.WhereClauseFilter;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.PropertyMetadata;
import io.intellixity.sqlchain.spi.CommandParameter;
import io.intellixity.sqlchain.spi.NativeCommandFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select: column list + filter + sort + paging\n
 * - structured (value) and caller-written (where clause) filters, always parameterized\n
 * - insert/update/delete from resolved column values\n
 *
 * DB-specific dialects override hooks for quoting, paging, output/returning and upsert syntax.
 * Every placeholder rendered here is a JDBC '?'.
 *
 * @param <N> the dialect's object name type
 */
public abstract class AbstractSqlDialect<N> {
  protected static final class RenderCtx {
    private final List<CommandParameter> params = new ArrayList<>();

    public RenderCtx() {}

    public String add(String name, Object value) {
      params.add(new CommandParameter(name, value));
      return "?";
    }

    public void addAll(List<CommandParameter> more) {
      params.addAll(more);
    }

    public List<CommandParameter> params() {
      return List.copyOf(params);
    }
  }

  /** Rendered SQL (a full statement or a fragment) with its parameters in placeholder order. */
  public record Rendered(String sql, List<CommandParameter> parameters) {
    public Rendered {
      parameters = List.copyOf(parameters);
    }

    public boolean isBlank() {
      return sql == null || sql.isBlank();
    }
  }

  /** A column and the value to write to it. */
  public record ColumnValue(ColumnMetadata column, Object value) {}

  /** Pieces of a SELECT that paging hooks may fill in. */
  public static final class SelectSql {
    private String top = "";
    private final String columns;
    private final String from;
    private String tableSample = "";
    private final String where;
    private String orderBy;
    private String suffix = "";

    SelectSql(String columns, String from, String where, String orderBy) {
      this.columns = columns;
      this.from = from;
      this.where = where;
      this.orderBy = orderBy;
    }

    /** Text inserted right after {@code SELECT}, e.g. {@code "TOP (10) "}. */
    public void top(String top) { this.top = top; }

    /** Text inserted right after the table name, e.g. a {@code TABLESAMPLE} clause. */
    public void tableSample(String tableSample) { this.tableSample = tableSample; }

    public boolean hasOrderBy() { return orderBy != null && !orderBy.isEmpty(); }

    public void orderBy(String orderBy) { this.orderBy = orderBy; }

    /** Text appended at the end, e.g. {@code " LIMIT 10"}. */
    public void suffix(String suffix) { this.suffix = suffix; }

    String render() {
      StringBuilder sb = new StringBuilder("SELECT ").append(top).append(columns).append(" FROM ").append(from)
          .append(tableSample);
      if (where != null && !where.isEmpty()) sb.append(" WHERE ").append(where);
      if (hasOrderBy()) sb.append(" ORDER BY ").append(orderBy);
      return sb.append(suffix).toString();
    }
  }

  /** Registry id, e.g. {@code "sqlite"}. */
  public abstract String id();

  public abstract String quoteIdent(String ident);

  public abstract String quoteObjectName(N name);

  /** Catalog for this dialect, reading the database through {@code commands}. */
  public abstract DatabaseMetadataCache<N> newMetadataCache(NativeCommandFactory commands, ClassMetadataCache types);

  // ---- select ----

  public final Rendered renderSelect(TableOrViewMetadata<N> table, List<ColumnMetadata> columns, Rendered where,
                                     List<SortExpression> sort, Limits limits) {
    List<String> cols = new ArrayList<>(columns.size());
    for (ColumnMetadata c : columns) cols.add(c.quotedSqlName());
    SelectSql select = new SelectSql(
        cols.isEmpty() ? "*" : String.join(", ", cols),
        quoteObjectName(table.name()),
        (where == null) ? null : where.sql(),
        renderOrderBy(table, sort));

    Limits l = (limits == null) ? Limits.NONE : limits;
    if (!l.isNone()) {
      validateLimits(l);
      applyLimits(select, l, table);
    }
    return new Rendered(select.render(), (where == null) ? List.of() : where.parameters());
  }

  protected String renderOrderBy(TableOrViewMetadata<N> table, List<SortExpression> sort) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (SortExpression s : sort) {
      ColumnMetadata c = table.tryGetColumn(s.columnName());
      if (c == null) {
        throw new MappingException("Cannot sort by " + s.columnName() + "; no such column on " + table.name());
      }
      parts.add(c.quotedSqlName() + (s.direction() == SortExpression.Direction.DESC ? " DESC" : " ASC"));
    }
    return String.join(", ", parts);
  }

  private void validateLimits(Limits l) {
    if (l.options() == LimitOptions.TOP && l.skip() != null) {
      throw new IllegalArgumentException("TOP cannot be combined with skip on dialect: " + id());
    }
    if (l.options() == LimitOptions.RANDOM_SAMPLE_ROWS && l.skip() != null) {
      throw new IllegalArgumentException("Random sampling cannot be combined with skip on dialect: " + id());
    }
    if ((l.options() == LimitOptions.TOP || l.options() == LimitOptions.RANDOM_SAMPLE_ROWS) && l.take() == null) {
      throw new IllegalArgumentException(l.options() + " requires take on dialect: " + id());
    }
  }

  /** Dialects render skip/take/top/sampling here. Called only for limits other than {@link Limits#NONE}. */
  protected abstract void applyLimits(SelectSql select, Limits limits, TableOrViewMetadata<N> table);

  /** For dialects that sample through {@code ORDER BY}: sampling replaces the caller's sort. */
  protected final void requireNoSortForSampling(SelectSql select) {
    if (select.hasOrderBy()) {
      throw new IllegalArgumentException("Random sampling cannot be combined with sorting on dialect: " + id());
    }
  }

  // ---- filters ----

  /** WHERE fragment (without the keyword) for a filter; {@code null} filter renders {@code null}. */
  public Rendered renderFilter(TableOrViewMetadata<N> table, TableFilter filter, ClassMetadataCache types) {
    if (filter == null) return null;
    if (filter instanceof WhereClauseFilter w) {
      NamedParameterSql.Compiled c = NamedParameterSql.compile(w.whereClause(),
          NamedParameterSql.argumentsOf(w.argumentValue(), types));
      return new Rendered(c.sql(), c.parameters());
    }
    if (filter instanceof ValueFilter v) return renderValueFilter(table, v, types);
    throw new IllegalArgumentException("Unsupported filter: " + filter.getClass().getName());
  }

  private Rendered renderValueFilter(TableOrViewMetadata<N> table, ValueFilter filter, ClassMetadataCache types) {
    Object source = filter.filterValue();
    boolean ignoreNulls = filter.options() == FilterOptions.IGNORE_NULL_PROPERTIES;
    RenderCtx ctx = new RenderCtx();
    List<String> terms = new ArrayList<>();
    int matched = 0;
    for (Map.Entry<String, Object> e : valuesOf(source, types).entrySet()) {
      ColumnMetadata c = table.tryGetColumn(e.getKey());
      if (c == null) continue;
      matched++;
      Object value = e.getValue();
      if (value == null) {
        if (!ignoreNulls) terms.add(c.quotedSqlName() + " IS NULL");
      } else {
        terms.add(c.quotedSqlName() + " = " + ctx.add(c.clrName(), value));
      }
    }
    if (matched == 0) {
      throw new MappingException("Unable to find any properties on type " + typeName(source)
          + " that match the columns on " + table.name());
    }
    // an empty predicate would match every row
    if (terms.isEmpty()) {
      throw new MappingException("Every property on type " + typeName(source) + " that matches a column on "
          + table.name() + " is null, so the filter has no terms");
    }
    return new Rendered(String.join(" AND ", terms), ctx.params());
  }

  /** Equality on every key column, for by-key update and delete. */
  public Rendered renderKeyPredicate(List<ColumnValue> keys) {
    RenderCtx ctx = new RenderCtx();
    List<String> terms = new ArrayList<>();
    for (ColumnValue k : keys) terms.add(k.column().quotedSqlName() + " = " + ctx.add(k.column().clrName(), k.value()));
    return new Rendered(String.join(" AND ", terms), ctx.params());
  }

  // ---- writes ----

  public Rendered renderInsert(TableOrViewMetadata<N> table, List<ColumnValue> values, List<ColumnMetadata> output) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("INSERT INTO ").append(quoteObjectName(table.name()));
    if (values.isEmpty()) {
      sb.append(insertOutputClause(output)).append(" DEFAULT VALUES");
    } else {
      List<String> cols = new ArrayList<>();
      List<String> ph = new ArrayList<>();
      for (ColumnValue v : values) {
        cols.add(v.column().quotedSqlName());
        ph.add(ctx.add(v.column().clrName(), v.value()));
      }
      sb.append(" (").append(String.join(", ", cols)).append(')')
          .append(insertOutputClause(output))
          .append(" VALUES (").append(String.join(", ", ph)).append(')');
    }
    sb.append(returningClause(output));
    return new Rendered(sb.toString(), ctx.params());
  }

  /** {@code SET} list (without the keyword) from column values. */
  public Rendered renderSetClause(List<ColumnValue> values) {
    if (values.isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (ColumnValue v : values) sets.add(v.column().quotedSqlName() + " = " + ctx.add(v.column().clrName(), v.value()));
    return new Rendered(String.join(", ", sets), ctx.params());
  }

  /** {@code where} may be {@code null} for an update of every row. */
  public Rendered renderUpdate(TableOrViewMetadata<N> table, Rendered set, Rendered where) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("UPDATE ").append(quoteObjectName(table.name()))
        .append(" SET ").append(set.sql());
    ctx.addAll(set.parameters());
    if (where != null && !where.isBlank()) {
      sb.append(" WHERE ").append(where.sql());
      ctx.addAll(where.parameters());
    }
    return new Rendered(sb.toString(), ctx.params());
  }

  /** {@code where} may be {@code null} for a delete of every row. */
  public Rendered renderDelete(TableOrViewMetadata<N> table, Rendered where) {
    StringBuilder sb = new StringBuilder("DELETE FROM ").append(quoteObjectName(table.name()));
    if (where == null || where.isBlank()) return new Rendered(sb.toString(), List.of());
    sb.append(" WHERE ").append(where.sql());
    return new Rendered(sb.toString(), where.parameters());
  }

  /**
   * DB-specific upsert.
   *
   * @param keys   match columns with their values
   * @param values non-key updatable columns with their values
   * @param output columns to return, empty for none
   */
  public abstract Rendered renderUpsert(TableOrViewMetadata<N> table, List<ColumnValue> keys, List<ColumnValue> values,
                                        List<ColumnMetadata> output);

  /**
   * {@code INSERT ... ON CONFLICT (keys) DO UPDATE SET c = EXCLUDED.c}, for dialects with that syntax.\n
   * With no non-key values the conflict branch is {@code DO NOTHING}.
   */
  protected final Rendered renderInsertOnConflict(TableOrViewMetadata<N> table, List<ColumnValue> keys,
                                                  List<ColumnValue> values, List<ColumnMetadata> output) {
    if (keys.isEmpty()) throw new IllegalArgumentException("Upsert has no conflict columns on " + table.name());
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    List<String> keyCols = new ArrayList<>();
    List<String> sets = new ArrayList<>();
    for (ColumnValue k : keys) {
      cols.add(k.column().quotedSqlName());
      ph.add(ctx.add(k.column().clrName(), k.value()));
      keyCols.add(k.column().quotedSqlName());
    }
    for (ColumnValue v : values) {
      String c = v.column().quotedSqlName();
      cols.add(c);
      ph.add(ctx.add(v.column().clrName(), v.value()));
      sets.add(c + " = EXCLUDED." + c);
    }
    String sql = "INSERT INTO " + quoteObjectName(table.name()) + " (" + join(cols) + ") VALUES (" + join(ph) + ")"
        + " ON CONFLICT (" + join(keyCols) + ")"
        + (sets.isEmpty() ? " DO NOTHING" : " DO UPDATE SET " + join(sets))
        + returningList(output);
    return new Rendered(sql, ctx.params());
  }

  /** Clause placed between the column list and {@code VALUES} (SQL Server {@code OUTPUT}). Default: none. */
  protected String insertOutputClause(List<ColumnMetadata> output) {
    return "";
  }

  /** Clause appended at the end of the statement ({@code RETURNING}). Default: none. */
  protected String returningClause(List<ColumnMetadata> output) {
    return "";
  }

  /** {@code " RETURNING a, b"} for dialects that use it. */
  protected static String returningList(List<ColumnMetadata> output) {
    if (output == null || output.isEmpty()) return "";
    List<String> cols = new ArrayList<>();
    for (ColumnMetadata c : output) cols.add(c.quotedSqlName());
    return " RETURNING " + String.join(", ", cols);
  }

  // ---- helpers ----

  /**
   * Name/value pairs of a filter or set source: Map entries as is, otherwise readable mapped properties by
   * column name. Decomposed properties are flattened with their prefix.
   */
  public static Map<String, Object> valuesOf(Object source, ClassMetadataCache types) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (source instanceof Map<?, ?> m) {
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), e.getValue());
      return out;
    }
    collect(source, "", types, out);
    return out;
  }

  private static void collect(Object source, String prefix, ClassMetadataCache types, Map<String, Object> out) {
    for (PropertyMetadata p : types.get(source.getClass()).properties()) {
      if (!p.canRead()) continue;
      if (p.decompose()) {
        Object child = p.get(source);
        if (child != null) collect(child, prefix + p.decompositionPrefix(), types, out);
      } else if (p.mappedColumnName() != null) {
        out.put(prefix + p.mappedColumnName(), p.get(source));
      }
    }
  }

  protected static String typeName(Object source) {
    return (source instanceof Map<?, ?>) ? "Map" : source.getClass().getSimpleName();
  }

  protected static String join(List<String> parts) {
    return String.join(", ", parts);
  }
}
