package io.intellixity.sqlchain.jdbc.postgres;

import io.intellixity.sqlchain.jdbc.dialect.CatalogQuery;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.List;

/**
 * PostgreSQL catalog over {@code information_schema}.\n
 *
 * Lookups ignore case; the metadata carries the names as stored. Unknown names are an error from
 * {@link #getTableOrView}. Identity covers both {@code GENERATED ... AS IDENTITY} and {@code serial} columns.
 */
public final class PostgresMetadataCache extends DatabaseMetadataCache<PostgresObjectName> {
  static final String FIND_OBJECT =
      "SELECT table_schema, table_name, table_type FROM information_schema.tables"
          + " WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?)"
          + " AND table_type IN ('BASE TABLE', 'VIEW')";
  static final String COLUMNS =
      "SELECT c.column_name, c.data_type, c.is_nullable, c.is_identity, c.column_default, c.is_generated,"
          + " CASE WHEN pk.column_name IS NULL THEN 0 ELSE 1 END AS is_primary_key"
          + " FROM information_schema.columns c"
          + " LEFT JOIN (SELECT kcu.table_schema, kcu.table_name, kcu.column_name"
          + " FROM information_schema.table_constraints tc"
          + " INNER JOIN information_schema.key_column_usage kcu"
          + " ON kcu.constraint_schema = tc.constraint_schema AND kcu.constraint_name = tc.constraint_name"
          + " WHERE tc.constraint_type = 'PRIMARY KEY') pk"
          + " ON pk.table_schema = c.table_schema AND pk.table_name = c.table_name AND pk.column_name = c.column_name"
          + " WHERE c.table_schema = ? AND c.table_name = ?"
          + " ORDER BY c.ordinal_position";
  static final String LIST_OBJECTS =
      "SELECT table_schema, table_name FROM information_schema.tables"
          + " WHERE table_type = ? AND table_schema NOT IN ('pg_catalog', 'information_schema')"
          + " ORDER BY table_schema, table_name";

  private final CatalogQuery catalog;
  private final PostgresDialect dialect;

  PostgresMetadataCache(NativeCommandFactory commands, ClassMetadataCache types, PostgresDialect dialect) {
    super(types);
    this.catalog = new CatalogQuery(commands);
    this.dialect = dialect;
  }

  @Override
  public PostgresObjectName parseObjectName(String name) {
    return PostgresObjectName.parse(name);
  }

  @Override
  protected boolean strictIntrospection() {
    return true;
  }

  @Override
  protected PostgresObjectName normalize(PostgresObjectName name) {
    return name.toLowerCase();
  }

  @Override
  protected TableOrViewMetadata<PostgresObjectName> discoverTableOrView(PostgresObjectName name) {
    String[] found = catalog.first(FIND_OBJECT, r -> new String[]{r.getString(0), r.getString(1), r.getString(2)},
        name.schema(), name.name());
    if (found == null) return null;

    PostgresObjectName actual = new PostgresObjectName(found[0], found[1]);
    List<ColumnMetadata> columns = catalog.list(COLUMNS, this::column, actual.schema(), actual.name());
    return newTableOrView(actual, "BASE TABLE".equals(found[2]), columns);
  }

  private ColumnMetadata column(RowCursor r) {
    String name = r.getString(0);
    String columnDefault = r.getString(4);
    boolean identity = "YES".equalsIgnoreCase(r.getString(3))
        || (columnDefault != null && columnDefault.startsWith("nextval("));
    boolean computed = "ALWAYS".equalsIgnoreCase(r.getString(5));
    return new ColumnMetadata(name, dialect.quoteIdent(name), r.getString(1), r.getInt(6) != 0, identity, computed,
        "YES".equalsIgnoreCase(r.getString(2)));
  }

  @Override
  protected List<PostgresObjectName> listTableNames() {
    return listNames("BASE TABLE");
  }

  @Override
  protected List<PostgresObjectName> listViewNames() {
    return listNames("VIEW");
  }

  private List<PostgresObjectName> listNames(String tableType) {
    return catalog.list(LIST_OBJECTS, r -> new PostgresObjectName(r.getString(0), r.getString(1)), tableType);
  }
}
