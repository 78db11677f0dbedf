package io.intellixity.sqlchain.jdbc.postgres;

import io.intellixity.sqlchain.MissingObjectException;
import io.intellixity.sqlchain.jdbc.dialect.SqlCommandBuilder;
import io.intellixity.sqlchain.jdbc.materialize.CompiledBinderCache;
import io.intellixity.sqlchain.jdbc.materialize.Materializers;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.InsertDescriptor;
import io.intellixity.sqlchain.op.SelectDescriptor;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.ExecutionToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.sqlchain.jdbc.postgres.ScriptedCatalog.row;
import static io.intellixity.sqlchain.jdbc.postgres.ScriptedCatalog.rows;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresMetadataCacheTest {
  public static class NewCustomer {
    private String name;
    private Integer score;

    public NewCustomer(String name, Integer score) {
      this.name = name;
      this.score = score;
    }

    public String getName() { return name; }
    public Integer getScore() { return score; }
  }

  private ScriptedCatalog catalog;
  private PostgresDialect dialect;
  private DatabaseMetadataCache<PostgresObjectName> md;

  @BeforeEach
  void setUp() {
    catalog = new ScriptedCatalog()
        .on(PostgresMetadataCache.FIND_OBJECT, List.of("table_schema", "table_name", "table_type"), args ->
            "public".equalsIgnoreCase((String) args.get(0)) && "customer".equalsIgnoreCase((String) args.get(1))
                ? rows(row("public", "Customer", "BASE TABLE"))
                : List.of())
        .on(PostgresMetadataCache.COLUMNS, List.of("column_name", "data_type", "is_nullable", "is_identity",
            "column_default", "is_generated", "is_primary_key"), args ->
            List.of("public", "Customer").equals(args)
                ? rows(
                    row("id", "integer", "NO", "YES", null, "NEVER", 1),
                    row("name", "text", "NO", "NO", null, "NEVER", 0),
                    row("score", "integer", "YES", "NO", null, "NEVER", 0),
                    row("total", "integer", "YES", "NO", null, "ALWAYS", 0),
                    row("legacy_id", "bigint", "NO", "NO", "nextval('customer_legacy_id_seq'::regclass)", "NEVER", 0))
                : List.of())
        .on(PostgresMetadataCache.LIST_OBJECTS, List.of("table_schema", "table_name"), args ->
            "BASE TABLE".equals(args.get(0)) ? rows(row("public", "Customer")) : List.of());
    dialect = new PostgresDialect();
    md = dialect.newMetadataCache(catalog, new ClassMetadataCache());
  }

  @Test
  void readsColumnFlags() {
    TableOrViewMetadata<PostgresObjectName> t = md.getTableOrView(md.parseObjectName("CUSTOMER"));
    assertEquals(new PostgresObjectName("public", "Customer"), t.name());
    assertTrue(t.isTable());
    assertEquals(List.of("id", "name", "score", "total", "legacy_id"),
        t.columns().stream().map(ColumnMetadata::sqlName).toList());

    ColumnMetadata id = t.tryGetColumn("ID");
    assertTrue(id.primaryKey());
    assertTrue(id.identity());
    assertFalse(id.nullable());
    assertTrue(t.tryGetColumn("score").nullable());
    assertTrue(t.tryGetColumn("total").computed());
    assertTrue(t.tryGetColumn("legacy_id").identity());
    assertEquals("\"legacy_id\"", t.tryGetColumn("legacy_id").quotedSqlName());
  }

  @Test
  void discoversEachNameOnce() {
    TableOrViewMetadata<PostgresObjectName> first = md.getTableOrView(md.parseObjectName("customer"));
    assertSame(first, md.getTableOrView(md.parseObjectName("public.Customer")));
    assertSame(first, md.tryGetTableOrView(new PostgresObjectName(null, "CUSTOMER")));
    assertEquals(List.of(PostgresMetadataCache.FIND_OBJECT, PostgresMetadataCache.COLUMNS), catalog.executed);
  }

  @Test
  void unknownNamesAreErrors() {
    PostgresObjectName missing = md.parseObjectName("sales.missing");
    MissingObjectException e = assertThrows(MissingObjectException.class, () -> md.getTableOrView(missing));
    assertEquals("sales.missing", e.objectName());
    assertNull(md.tryGetTableOrView(missing));
    assertEquals(1, catalog.executed.size());
    assertNull(md.getStoredProcedure(missing));
  }

  @Test
  void preloadsTables() {
    md.preloadTables();
    assertEquals(1, md.cachedTablesAndViews().size());
    md.preloadViews();
    assertEquals(1, md.cachedTablesAndViews().size());
  }

  @Test
  void buildsStatementsFromDiscoveredColumns() {
    SqlCommandBuilder<PostgresObjectName> builder = new SqlCommandBuilder<>(dialect, md, true);
    Materializers m = new Materializers(md.types(), new CompiledBinderCache(), false);

    ExecutionToken select = builder.prepareSelect(SelectDescriptor.from("customer").withFilter(Map.of("name", "Ada")),
        m.toMaps());
    assertEquals("SELECT \"id\", \"name\", \"score\", \"total\", \"legacy_id\" FROM \"public\".\"Customer\""
        + " WHERE \"name\" = ?", select.commandText());
    assertEquals("Ada", select.parameters().get(0).value());

    ExecutionToken insert = builder.prepareInsert(new InsertDescriptor("customer", new NewCustomer("Ada", 3)),
        m.rowsAffected());
    assertEquals("INSERT INTO \"public\".\"Customer\" (\"name\", \"score\") VALUES (?, ?)", insert.commandText());

    ExecutionToken returning = builder.prepareInsert(new InsertDescriptor("customer", new NewCustomer("Ada", 3)),
        m.toScalar(Integer.class, "id"));
    assertTrue(returning.commandText().endsWith(" RETURNING \"id\""), returning.commandText());
    assertTrue(returning.returnsRows());
  }
}
