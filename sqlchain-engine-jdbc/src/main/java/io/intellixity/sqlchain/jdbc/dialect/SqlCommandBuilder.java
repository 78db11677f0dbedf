package io.intellixity.sqlchain.jdbc.dialect;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.MissingObjectException;
import io.intellixity.sqlchain.jdbc.NamedParameterSql;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.ColumnValue;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.Rendered;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.ColumnPropertyMap;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.PropertiesFilter;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.DeleteDescriptor;
import io.intellixity.sqlchain.op.DeleteOptions;
import io.intellixity.sqlchain.op.InsertDescriptor;
import io.intellixity.sqlchain.op.SelectDescriptor;
import io.intellixity.sqlchain.op.TableFilter;
import io.intellixity.sqlchain.op.UpdateDescriptor;
import io.intellixity.sqlchain.op.UpdateOptions;
import io.intellixity.sqlchain.op.UpsertDescriptor;
import io.intellixity.sqlchain.op.UpsertOptions;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.LockMode;
import io.intellixity.sqlchain.spi.Materializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Prepares execution tokens from operation descriptors.\n
 *
 * Responsibilities:\n
 * - Resolve the target table or view through the metadata cache\n
 * - Resolve the materializer's desired columns against it (strict: unknown names fail; lenient: dropped)\n
 * - Map argument properties to columns with the write masks of each operation\n
 * - Chain a read-back SELECT to updates and deletes that must return rows\n
 *
 * Building is synchronous and touches the database only through metadata discovery.
 */
public final class SqlCommandBuilder<N> {
  private static final Logger log = LoggerFactory.getLogger(SqlCommandBuilder.class);

  private final AbstractSqlDialect<N> dialect;
  private final DatabaseMetadataCache<N> metadata;
  private final boolean strictMode;

  public SqlCommandBuilder(AbstractSqlDialect<N> dialect, DatabaseMetadataCache<N> metadata, boolean strictMode) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.strictMode = strictMode;
  }

  public AbstractSqlDialect<N> dialect() { return dialect; }

  public DatabaseMetadataCache<N> metadata() { return metadata; }

  public boolean strictMode() { return strictMode; }

  /** Table or view by name; {@link MissingObjectException} when the catalog does not have it. */
  public TableOrViewMetadata<N> table(String tableName) {
    N name = metadata.parseObjectName(tableName);
    TableOrViewMetadata<N> t = metadata.getTableOrView(name);
    if (t == null) {
      throw new MissingObjectException(tableName, "Cannot find a table or view named " + tableName);
    }
    return t;
  }

  // ---- select ----

  public ExecutionToken prepareSelect(SelectDescriptor d, Materializer<?> materializer) {
    Objects.requireNonNull(d, "descriptor");
    TableOrViewMetadata<N> table = table(d.tableName());
    DesiredColumns desired = materializer.desiredColumns();
    if (desired.isNone()) {
      throw new IllegalArgumentException("A select needs at least one column; the materializer asked for none");
    }
    List<ColumnMetadata> columns = resolveDesiredColumns(table, desired);
    Rendered where = dialect.renderFilter(table, d.filter(), types());
    Rendered sql = dialect.renderSelect(table, columns, where, d.sort(), d.limits());
    return trace(ExecutionToken.query("SELECT", sql.sql(), sql.parameters()));
  }

  // ---- insert ----

  public ExecutionToken prepareInsert(InsertDescriptor d, Materializer<?> materializer) {
    Objects.requireNonNull(d, "descriptor");
    TableOrViewMetadata<N> table = table(d.tableName());
    Object arg = d.argumentValue();
    List<ColumnValue> values = columnValues(table, arg, writeMask(PropertiesFilter.UPDATABLE_ONLY));
    // DEFAULT VALUES only for objects that do map some column, all of them generated
    if (values.isEmpty() && !(arg instanceof Map<?, ?>) && table.getPropertiesFor(arg.getClass()).isEmpty()) {
      throw noMatch(arg, table);
    }
    List<ColumnMetadata> output = outputColumns(table, materializer);
    Rendered sql = dialect.renderInsert(table, values, output);
    return trace(writeToken("INSERT", sql, !output.isEmpty()));
  }

  // ---- update ----

  public ExecutionToken prepareUpdate(UpdateDescriptor d, Materializer<?> materializer) {
    Objects.requireNonNull(d, "descriptor");
    TableOrViewMetadata<N> table = table(d.tableName());

    Rendered set;
    Rendered where;
    Integer expected = d.expectedRowCount();
    if (d.byKey()) {
      boolean useKeyAttribute = d.has(UpdateOptions.USE_KEY_ATTRIBUTE);
      List<ColumnValue> keys = columnValues(table, d.argumentValue(), keyMask(useKeyAttribute));
      List<ColumnValue> sets = columnValues(table, d.argumentValue(), useKeyAttribute
          ? writeMask(PropertiesFilter.OBJECT_DEFINED_NON_KEY, PropertiesFilter.UPDATABLE_ONLY, PropertiesFilter.THROW_ON_NO_MATCH)
          : writeMask(PropertiesFilter.NON_PRIMARY_KEY, PropertiesFilter.UPDATABLE_ONLY, PropertiesFilter.THROW_ON_NO_MATCH));
      set = dialect.renderSetClause(sets);
      where = dialect.renderKeyPredicate(keys);
      if (expected == null && !d.has(UpdateOptions.IGNORE_ROWS_AFFECTED)) expected = 1;
    } else {
      set = (d.updateExpression() != null)
          ? compileExpression(d.updateExpression(), d.expressionArguments())
          : dialect.renderSetClause(setValues(table, d.argumentValue()));
      where = setBasedWhere(table, d.filter(), d.allRows(), "update");
    }

    Rendered sql = dialect.renderUpdate(table, set, where);
    ExecutionToken write = writeToken("UPDATE", sql, false).withExpectedRowCount(expected);
    return trace(withReadBack(table, write, where, materializer, d.has(UpdateOptions.RETURN_OLD_VALUES)));
  }

  // ---- upsert ----

  public ExecutionToken prepareUpsert(UpsertDescriptor d, Materializer<?> materializer) {
    Objects.requireNonNull(d, "descriptor");
    TableOrViewMetadata<N> table = table(d.tableName());
    Object arg = d.argumentValue();

    List<ColumnValue> keys;
    if (!d.matchColumns().isEmpty()) {
      keys = matchColumnValues(table, arg, d.matchColumns());
    } else {
      keys = columnValues(table, arg, keyMask(d.has(UpsertOptions.USE_KEY_ATTRIBUTE)));
    }

    List<ColumnValue> values = new ArrayList<>();
    for (ColumnValue v : columnValues(table, arg, writeMask(PropertiesFilter.UPDATABLE_ONLY))) {
      if (!containsColumn(keys, v.column())) values.add(v);
    }

    List<ColumnMetadata> output = outputColumns(table, materializer);
    Rendered sql = dialect.renderUpsert(table, keys, values, output);
    return trace(writeToken("UPSERT", sql, !output.isEmpty()));
  }

  // ---- delete ----

  public ExecutionToken prepareDelete(DeleteDescriptor d, Materializer<?> materializer) {
    Objects.requireNonNull(d, "descriptor");
    TableOrViewMetadata<N> table = table(d.tableName());

    Rendered where;
    Integer expected = d.expectedRowCount();
    if (d.byKey()) {
      List<ColumnValue> keys = columnValues(table, d.argumentValue(), keyMask(d.has(DeleteOptions.USE_KEY_ATTRIBUTE)));
      where = dialect.renderKeyPredicate(keys);
      if (expected == null && !d.has(DeleteOptions.IGNORE_ROWS_AFFECTED)) expected = 1;
    } else {
      where = setBasedWhere(table, d.filter(), d.allRows(), "delete");
    }

    Rendered sql = dialect.renderDelete(table, where);
    ExecutionToken write = writeToken("DELETE", sql, false).withExpectedRowCount(expected);
    // deleted rows can only be read before the delete
    return trace(withReadBack(table, write, where, materializer, true));
  }

  // ---- column resolution ----

  /**
   * Columns of {@code table} for a desired-column request.\n
   * {@code all} is every column; {@code none} is no column; names are matched ignoring case, unknown names
   * fail in strict mode and are dropped otherwise. A request that leaves no column fails.
   */
  public List<ColumnMetadata> resolveDesiredColumns(TableOrViewMetadata<N> table, DesiredColumns desired) {
    if (desired.isAll()) return table.columns();
    if (desired.isNone()) return List.of();

    List<ColumnMetadata> out = new ArrayList<>();
    for (String name : desired.names()) {
      ColumnMetadata c = table.tryGetColumn(name);
      if (c == null) {
        if (strictMode) {
          throw new MappingException("Strict mode was enabled, but the desired column " + name
              + " was not found on " + table.name());
        }
        continue;
      }
      out.add(c);
    }
    if (out.isEmpty()) {
      throw new MappingException("None of the desired columns " + desired.names() + " were found on " + table.name());
    }
    return List.copyOf(out);
  }

  private List<ColumnMetadata> outputColumns(TableOrViewMetadata<N> table, Materializer<?> materializer) {
    DesiredColumns desired = materializer.desiredColumns();
    return desired.isNone() ? List.of() : resolveDesiredColumns(table, desired);
  }

  private List<ColumnValue> columnValues(TableOrViewMetadata<N> table, Object arg, Set<PropertiesFilter> mask) {
    if (arg instanceof Map<?, ?> map) return entryValues(table, map, mask);
    List<ColumnValue> out = new ArrayList<>();
    for (ColumnPropertyMap m : table.getPropertiesFor(arg.getClass(), mask)) {
      if (!m.property().canRead()) continue;
      out.add(new ColumnValue(m.column(), m.property().get(arg)));
    }
    return out;
  }

  /**
   * Column values from Map entries, keys matched to column names ignoring case. The mask applies as it does to
   * properties; {@code @Key} filters have nothing to read on a Map. Entries that name no column fail under
   * {@code THROW_ON_MISSING_COLUMNS}, and a Map naming no column at all always fails.
   */
  private List<ColumnValue> entryValues(TableOrViewMetadata<N> table, Map<?, ?> map, Set<PropertiesFilter> mask) {
    if (mask.contains(PropertiesFilter.OBJECT_DEFINED_KEY) || mask.contains(PropertiesFilter.OBJECT_DEFINED_NON_KEY)) {
      throw new MappingException("A Map argument has no @Key properties; match " + table.name()
          + " on its primary key or on explicit match columns");
    }
    List<ColumnValue> out = new ArrayList<>();
    Set<String> present = new HashSet<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      String key = String.valueOf(e.getKey());
      ColumnMetadata c = table.tryGetColumn(key);
      if (c == null) {
        if (mask.contains(PropertiesFilter.THROW_ON_MISSING_COLUMNS)) {
          throw new MappingException("The table " + table.name() + " has no column " + key);
        }
        continue;
      }
      present.add(c.sqlName());
      if (mask.contains(PropertiesFilter.PRIMARY_KEY) && !c.primaryKey()) continue;
      if (mask.contains(PropertiesFilter.NON_PRIMARY_KEY) && c.primaryKey()) continue;
      if (mask.contains(PropertiesFilter.UPDATABLE_ONLY) && !c.updatable()) continue;
      out.add(new ColumnValue(c, e.getValue()));
    }
    if (present.isEmpty()) throw noMatch(map, table);
    if (mask.contains(PropertiesFilter.PRIMARY_KEY) && mask.contains(PropertiesFilter.THROW_ON_MISSING_PROPERTIES)) {
      List<String> missing = new ArrayList<>();
      for (ColumnMetadata k : table.primaryKeyColumns()) {
        if (!present.contains(k.sqlName())) missing.add(k.sqlName());
      }
      if (!missing.isEmpty()) {
        throw new MappingException("The Map argument is missing an entry for the primary key column(s): "
            + String.join(", ", missing) + " on table " + table.name());
      }
    }
    if (out.isEmpty() && mask.contains(PropertiesFilter.THROW_ON_NO_MATCH)) throw noMatch(map, table);
    return out;
  }

  private MappingException noMatch(Object arg, TableOrViewMetadata<N> table) {
    return new MappingException("Unable to find any properties on type " + AbstractSqlDialect.typeName(arg)
        + " that match the columns on " + table.name());
  }

  private List<ColumnValue> matchColumnValues(TableOrViewMetadata<N> table, Object arg, List<String> matchColumns) {
    if (arg instanceof Map<?, ?> map) {
      List<ColumnValue> out = new ArrayList<>();
      for (String name : matchColumns) {
        ColumnMetadata c = table.tryGetColumn(name);
        if (c == null) throw new MappingException("Cannot match on " + name + "; no such column on " + table.name());
        ColumnValue v = entryValues(table, map, Set.of()).stream()
            .filter(x -> x.column() == c).findFirst().orElseThrow(() ->
                new MappingException("The Map argument has no entry for the match column " + c.sqlName()
                    + " on " + table.name()));
        out.add(v);
      }
      return out;
    }
    List<ColumnPropertyMap> all = table.getPropertiesFor(arg.getClass(), writeMask());
    List<ColumnValue> out = new ArrayList<>();
    for (String name : matchColumns) {
      ColumnMetadata c = table.tryGetColumn(name);
      if (c == null) throw new MappingException("Cannot match on " + name + "; no such column on " + table.name());
      ColumnPropertyMap m = all.stream().filter(x -> x.column() == c).findFirst().orElseThrow(() ->
          new MappingException("The type " + arg.getClass().getSimpleName() + " has no property mapped to the match column "
              + c.sqlName() + " on " + table.name()));
      out.add(new ColumnValue(c, m.property().get(arg)));
    }
    return out;
  }

  /** SET values of a set-based update: Map entries or mapped properties that name an updatable column. */
  private List<ColumnValue> setValues(TableOrViewMetadata<N> table, Object newValues) {
    if (!(newValues instanceof Map<?, ?>) && strictMode) {
      // fails on mapped properties without a column
      table.getPropertiesFor(newValues.getClass(), writeMask());
    }
    List<ColumnValue> out = new ArrayList<>();
    int matched = 0;
    for (Map.Entry<String, Object> e : AbstractSqlDialect.valuesOf(newValues, types()).entrySet()) {
      ColumnMetadata c = table.tryGetColumn(e.getKey());
      if (c == null) {
        if (strictMode && newValues instanceof Map<?, ?>) {
          throw new MappingException("The table " + table.name() + " has no column " + e.getKey());
        }
        continue;
      }
      matched++;
      if (c.updatable()) out.add(new ColumnValue(c, e.getValue()));
    }
    if (matched == 0) {
      throw new MappingException("Unable to find any properties on type " + AbstractSqlDialect.typeName(newValues)
          + " that match the columns on " + table.name());
    }
    return out;
  }

  private Rendered setBasedWhere(TableOrViewMetadata<N> table, TableFilter filter,
                                 boolean allRows, String operation) {
    if (filter == null && !allRows) {
      throw new IllegalArgumentException("A set-based " + operation + " needs a filter or an explicit all-rows request");
    }
    return dialect.renderFilter(table, filter, types());
  }

  private Rendered compileExpression(String expression, Object arguments) {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(expression, NamedParameterSql.argumentsOf(arguments, types()));
    return new Rendered(c.sql(), c.parameters());
  }

  private Set<PropertiesFilter> keyMask(boolean useKeyAttribute) {
    return useKeyAttribute
        ? writeMask(PropertiesFilter.OBJECT_DEFINED_KEY, PropertiesFilter.THROW_ON_NO_MATCH)
        : writeMask(PropertiesFilter.PRIMARY_KEY, PropertiesFilter.THROW_ON_MISSING_PROPERTIES, PropertiesFilter.THROW_ON_NO_MATCH);
  }

  /** Write-direction mask: strict mode also fails on mapped properties without a column. */
  private Set<PropertiesFilter> writeMask(PropertiesFilter... filters) {
    Set<PropertiesFilter> out = EnumSet.noneOf(PropertiesFilter.class);
    out.addAll(List.of(filters));
    if (strictMode) out.add(PropertiesFilter.THROW_ON_MISSING_COLUMNS);
    return out;
  }

  // ---- tokens ----

  private ExecutionToken writeToken(String operation, Rendered sql, boolean returnsRows) {
    ExecutionToken t = returnsRows
        ? ExecutionToken.query(operation, sql.sql(), sql.parameters())
        : ExecutionToken.nonQuery(operation, sql.sql(), sql.parameters());
    return t.withLockMode(LockMode.WRITE);
  }

  /**
   * Adds a SELECT over the write's predicate when the materializer wants rows: before the write when old
   * values are wanted, after it otherwise.
   */
  private ExecutionToken withReadBack(TableOrViewMetadata<N> table, ExecutionToken write, Rendered where,
                                      Materializer<?> materializer, boolean oldValues) {
    DesiredColumns desired = materializer.desiredColumns();
    if (desired.isNone()) return write;
    List<ColumnMetadata> columns = resolveDesiredColumns(table, desired);
    Rendered select = dialect.renderSelect(table, columns, where, List.of(), null);
    ExecutionToken read = ExecutionToken.query("SELECT", select.sql(), select.parameters());
    return oldValues ? read.withNext(write) : write.withNext(read);
  }

  private static boolean containsColumn(List<ColumnValue> values, ColumnMetadata column) {
    for (ColumnValue v : values) {
      if (v.column().sqlName().equalsIgnoreCase(column.sqlName())) return true;
    }
    return false;
  }

  private ClassMetadataCache types() {
    return metadata.types();
  }

  private static ExecutionToken trace(ExecutionToken t) {
    if (log.isDebugEnabled()) {
      log.debug("sqlchain.build op={} tokens={} lock={} sql={}",
          t.operation(), t.chain().size(), t.chainLockMode(), t.commandText());
    }
    return t;
  }
}
