package io.intellixity.sqlchain.jdbc.sqlite;

import io.intellixity.sqlchain.jdbc.dialect.CatalogQuery;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SQLite catalog over {@code sqlite_master} and {@code pragma_table_xinfo}.\n
 *
 * Names are matched ignoring case. Unknown names resolve to {@code null}; SQLite has no stored procedures or
 * table functions, so those lookups are always {@code null} too.\n
 * A lone {@code INTEGER} primary key aliases the rowid and is treated as an identity column.
 */
public final class SqliteMetadataCache extends DatabaseMetadataCache<String> {
  private static final String FIND_OBJECT =
      "SELECT type, name FROM sqlite_master WHERE type IN ('table', 'view') AND name = ? COLLATE NOCASE";
  private static final String COLUMNS =
      "SELECT name, type, \"notnull\", pk, hidden FROM pragma_table_xinfo(?) ORDER BY cid";
  private static final String LIST_OBJECTS =
      "SELECT name FROM sqlite_master WHERE type = ? AND name NOT LIKE 'sqlite_%' ORDER BY name";

  private final CatalogQuery catalog;
  private final SqliteDialect dialect;

  SqliteMetadataCache(NativeCommandFactory commands, ClassMetadataCache types, SqliteDialect dialect) {
    super(types);
    this.catalog = new CatalogQuery(commands);
    this.dialect = dialect;
  }

  @Override
  public String parseObjectName(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("object name is required");
    String n = name.trim();
    if (n.length() > 1 && n.startsWith("\"") && n.endsWith("\"")) n = n.substring(1, n.length() - 1).replace("\"\"", "\"");
    return n;
  }

  @Override
  protected boolean strictIntrospection() {
    return false;
  }

  @Override
  protected String normalize(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  @Override
  protected TableOrViewMetadata<String> discoverTableOrView(String name) {
    String[] found = catalog.first(FIND_OBJECT, r -> new String[]{r.getString(0), r.getString(1)}, name);
    if (found == null) return null;

    String actualName = found[1];
    List<RawColumn> raw = catalog.list(COLUMNS, SqliteMetadataCache::rawColumn, actualName);
    long pkCount = raw.stream().filter(c -> c.pk() > 0).count();

    List<ColumnMetadata> columns = new ArrayList<>(raw.size());
    for (RawColumn c : raw) {
      if (c.hidden() == 1) continue;
      boolean pk = c.pk() > 0;
      boolean identity = pk && pkCount == 1 && "INTEGER".equalsIgnoreCase(c.type());
      boolean computed = c.hidden() == 2 || c.hidden() == 3;
      columns.add(new ColumnMetadata(c.name(), dialect.quoteIdent(c.name()), c.type(), pk, identity, computed,
          !c.notNull() && !identity));
    }
    return newTableOrView(actualName, "table".equalsIgnoreCase(found[0]), columns);
  }

  @Override
  protected List<String> listTableNames() {
    return catalog.list(LIST_OBJECTS, r -> r.getString(0), "table");
  }

  @Override
  protected List<String> listViewNames() {
    return catalog.list(LIST_OBJECTS, r -> r.getString(0), "view");
  }

  private static RawColumn rawColumn(RowCursor r) {
    String type = r.getString(1);
    return new RawColumn(r.getString(0), (type == null || type.isEmpty()) ? null : type,
        r.getInt(2) != 0, r.getInt(3), r.getInt(4));
  }

  private record RawColumn(String name, String type, boolean notNull, int pk, int hidden) {}
}
