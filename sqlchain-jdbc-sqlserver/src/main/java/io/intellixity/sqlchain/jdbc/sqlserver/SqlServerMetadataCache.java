package io.intellixity.sqlchain.jdbc.sqlserver;

import io.intellixity.sqlchain.jdbc.dialect.CatalogQuery;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.ParameterMetadata;
import io.intellixity.sqlchain.metadata.StoredProcedureMetadata;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.RowCursor;
import io.intellixity.sqlchain.util.Lazy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQL Server catalog over the {@code sys.*} views.\n
 *
 * Tables and views are strict: an unknown name is a {@link io.intellixity.sqlchain.MissingObjectException} from
 * {@link #getTableOrView}. Stored procedures and table-valued functions resolve to {@code null} when missing.
 * Every lookup is discovered once per name and kept for the life of the cache.
 */
public final class SqlServerMetadataCache extends DatabaseMetadataCache<SqlServerObjectName> {
  private static final Logger log = LoggerFactory.getLogger(SqlServerMetadataCache.class);

  static final String FIND_OBJECT =
      "SELECT s.name AS SchemaName, o.name AS Name, o.type AS ObjectType, o.object_id AS ObjectId"
          + " FROM sys.objects o INNER JOIN sys.schemas s ON s.schema_id = o.schema_id"
          + " WHERE o.type IN ('U', 'V') AND s.name = ? AND o.name = ?";
  static final String FIND_FUNCTION =
      "SELECT s.name AS SchemaName, o.name AS Name, o.type AS ObjectType, o.object_id AS ObjectId"
          + " FROM sys.objects o INNER JOIN sys.schemas s ON s.schema_id = o.schema_id"
          + " WHERE o.type IN ('IF', 'TF') AND s.name = ? AND o.name = ?";
  static final String FIND_PROCEDURE =
      "SELECT s.name AS SchemaName, o.name AS Name, o.type AS ObjectType, o.object_id AS ObjectId"
          + " FROM sys.procedures o INNER JOIN sys.schemas s ON s.schema_id = o.schema_id"
          + " WHERE s.name = ? AND o.name = ?";
  static final String COLUMNS =
      "SELECT c.name AS ColumnName, t.name AS TypeName, c.is_nullable, c.is_identity, c.is_computed,"
          + " CONVERT(BIT, CASE WHEN pk.column_id IS NULL THEN 0 ELSE 1 END) AS is_primary_key"
          + " FROM sys.columns c"
          + " INNER JOIN sys.types t ON t.user_type_id = c.user_type_id"
          + " LEFT JOIN (SELECT ic.object_id, ic.column_id FROM sys.indexes i"
          + " INNER JOIN sys.index_columns ic ON ic.object_id = i.object_id AND ic.index_id = i.index_id"
          + " WHERE i.is_primary_key = 1) pk ON pk.object_id = c.object_id AND pk.column_id = c.column_id"
          + " WHERE c.object_id = ?"
          + " ORDER BY c.column_id";
  static final String PARAMETERS =
      "SELECT p.name AS ParameterName, t.name AS TypeName, p.is_output"
          + " FROM sys.parameters p INNER JOIN sys.types t ON t.user_type_id = p.user_type_id"
          + " WHERE p.object_id = ? AND p.parameter_id > 0"
          + " ORDER BY p.parameter_id";
  static final String LIST_OBJECTS =
      "SELECT s.name AS SchemaName, o.name AS Name"
          + " FROM sys.objects o INNER JOIN sys.schemas s ON s.schema_id = o.schema_id"
          + " WHERE o.type = ? AND o.is_ms_shipped = 0"
          + " ORDER BY s.name, o.name";

  private final ConcurrentHashMap<SqlServerObjectName, Lazy<StoredProcedureMetadata<SqlServerObjectName>>> procedures =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<SqlServerObjectName, Lazy<TableOrViewMetadata<SqlServerObjectName>>> functions =
      new ConcurrentHashMap<>();
  private final CatalogQuery catalog;
  private final SqlServerDialect dialect;

  SqlServerMetadataCache(NativeCommandFactory commands, ClassMetadataCache types, SqlServerDialect dialect) {
    super(types);
    this.catalog = new CatalogQuery(commands);
    this.dialect = dialect;
  }

  @Override
  public SqlServerObjectName parseObjectName(String name) {
    return SqlServerObjectName.parse(name);
  }

  @Override
  protected boolean strictIntrospection() {
    return true;
  }

  // default collations compare names without case
  @Override
  protected SqlServerObjectName normalize(SqlServerObjectName name) {
    return name.toLowerCase();
  }

  @Override
  protected TableOrViewMetadata<SqlServerObjectName> discoverTableOrView(SqlServerObjectName name) {
    CatalogObject o = find(FIND_OBJECT, name);
    if (o == null) return null;
    return newTableOrView(o.name(), "U".equals(o.type()), columns(o.objectId()));
  }

  @Override
  public TableOrViewMetadata<SqlServerObjectName> getTableFunction(SqlServerObjectName name) {
    Objects.requireNonNull(name, "name");
    return getOrDiscover(functions, normalize(name), k -> {
      CatalogObject o = find(FIND_FUNCTION, k);
      if (log.isDebugEnabled()) log.debug("sqlchain.metadata op=discover_function name={} found={}", k, o != null);
      return (o == null) ? null : newTableOrView(o.name(), false, columns(o.objectId()));
    });
  }

  @Override
  public StoredProcedureMetadata<SqlServerObjectName> getStoredProcedure(SqlServerObjectName name) {
    Objects.requireNonNull(name, "name");
    return getOrDiscover(procedures, normalize(name), k -> {
      CatalogObject o = find(FIND_PROCEDURE, k);
      if (log.isDebugEnabled()) log.debug("sqlchain.metadata op=discover_procedure name={} found={}", k, o != null);
      if (o == null) return null;
      List<ParameterMetadata> params = catalog.list(PARAMETERS,
          r -> new ParameterMetadata(r.getString(0), r.getString(1), r.getBoolean(2)), o.objectId());
      return new StoredProcedureMetadata<>(o.name(), params);
    });
  }

  @Override
  protected List<SqlServerObjectName> listTableNames() {
    return listNames("U");
  }

  @Override
  protected List<SqlServerObjectName> listViewNames() {
    return listNames("V");
  }

  private List<SqlServerObjectName> listNames(String type) {
    return catalog.list(LIST_OBJECTS, r -> new SqlServerObjectName(r.getString(0), r.getString(1)), type);
  }

  private CatalogObject find(String sql, SqlServerObjectName name) {
    return catalog.first(sql, r -> new CatalogObject(new SqlServerObjectName(r.getString(0), r.getString(1)),
        r.getString(2).trim(), r.getInt(3)), name.schema(), name.name());
  }

  private List<ColumnMetadata> columns(int objectId) {
    return catalog.list(COLUMNS, this::column, objectId);
  }

  private ColumnMetadata column(RowCursor r) {
    String name = r.getString(0);
    String type = r.getString(1);
    // rowversion is written by the server
    boolean computed = r.getBoolean(4) || "timestamp".equalsIgnoreCase(type) || "rowversion".equalsIgnoreCase(type);
    return new ColumnMetadata(name, dialect.quoteIdent(name), type, r.getBoolean(5), r.getBoolean(3), computed,
        r.getBoolean(2));
  }

  private record CatalogObject(SqlServerObjectName name, String type, int objectId) {}
}
