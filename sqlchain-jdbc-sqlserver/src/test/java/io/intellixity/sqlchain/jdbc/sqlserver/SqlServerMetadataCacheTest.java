package io.intellixity.sqlchain.jdbc.sqlserver;

import io.intellixity.sqlchain.MissingObjectException;
import io.intellixity.sqlchain.jdbc.dialect.SqlCommandBuilder;
import io.intellixity.sqlchain.jdbc.materialize.CompiledBinderCache;
import io.intellixity.sqlchain.jdbc.materialize.Materializers;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.DatabaseMetadataCache;
import io.intellixity.sqlchain.metadata.ParameterMetadata;
import io.intellixity.sqlchain.metadata.StoredProcedureMetadata;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.InsertDescriptor;
import io.intellixity.sqlchain.op.UpdateDescriptor;
import io.intellixity.sqlchain.op.UpsertDescriptor;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.ExecutionToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.sqlchain.jdbc.sqlserver.ScriptedCatalog.row;
import static io.intellixity.sqlchain.jdbc.sqlserver.ScriptedCatalog.rows;
import static org.junit.jupiter.api.Assertions.*;

final class SqlServerMetadataCacheTest {
  public static class Customer {
    private int id;
    private String name;

    public Customer() {}

    Customer(int id, String name) {
      this.id = id;
      this.name = name;
    }

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
  }

  private static final List<String> OBJECT_COLUMNS = List.of("SchemaName", "Name", "ObjectType", "ObjectId");

  private ScriptedCatalog catalog;
  private SqlServerDialect dialect;
  private DatabaseMetadataCache<SqlServerObjectName> md;

  private static boolean named(List<Object> args, String schema, String name) {
    return schema.equalsIgnoreCase((String) args.get(0)) && name.equalsIgnoreCase((String) args.get(1));
  }

  @BeforeEach
  void setUp() {
    catalog = new ScriptedCatalog()
        .on(SqlServerMetadataCache.FIND_OBJECT, OBJECT_COLUMNS, args ->
            named(args, "dbo", "Customer") ? rows(row("dbo", "Customer", "U ", 101))
                : named(args, "dbo", "ActiveCustomer") ? rows(row("dbo", "ActiveCustomer", "V ", 102))
                : List.of())
        .on(SqlServerMetadataCache.FIND_FUNCTION, OBJECT_COLUMNS, args ->
            named(args, "dbo", "CustomersByName") ? rows(row("dbo", "CustomersByName", "IF", 201)) : List.of())
        .on(SqlServerMetadataCache.FIND_PROCEDURE, OBJECT_COLUMNS, args ->
            named(args, "dbo", "RenameCustomer") ? rows(row("dbo", "RenameCustomer", "P ", 301)) : List.of())
        .on(SqlServerMetadataCache.COLUMNS, List.of("ColumnName", "TypeName", "is_nullable", "is_identity",
            "is_computed", "is_primary_key"), args -> switch ((Integer) args.get(0)) {
              case 101 -> rows(
                  row("Id", "int", false, true, false, true),
                  row("Name", "nvarchar", false, false, false, false),
                  row("Display", "nvarchar", true, false, true, false),
                  row("Version", "timestamp", false, false, false, false));
              case 102, 201 -> rows(
                  row("Id", "int", false, false, false, false),
                  row("Name", "nvarchar", false, false, false, false));
              default -> List.of();
            })
        .on(SqlServerMetadataCache.PARAMETERS, List.of("ParameterName", "TypeName", "is_output"), args ->
            Integer.valueOf(301).equals(args.get(0))
                ? rows(row("@Id", "int", false), row("@Name", "nvarchar", false), row("@Previous", "nvarchar", true))
                : List.of())
        .on(SqlServerMetadataCache.LIST_OBJECTS, List.of("SchemaName", "Name"), args ->
            "U".equals(args.get(0)) ? rows(row("dbo", "Customer")) : rows(row("dbo", "ActiveCustomer")));
    dialect = new SqlServerDialect();
    md = dialect.newMetadataCache(catalog, new ClassMetadataCache());
  }

  @Test
  void readsTablesAndViews() {
    TableOrViewMetadata<SqlServerObjectName> t = md.getTableOrView(md.parseObjectName("[DBO].[customer]"));
    assertEquals(new SqlServerObjectName("dbo", "Customer"), t.name());
    assertTrue(t.isTable());
    ColumnMetadata id = t.tryGetColumn("id");
    assertTrue(id.primaryKey() && id.identity());
    assertEquals("[Id]", id.quotedSqlName());
    assertTrue(t.tryGetColumn("Display").computed());
    assertTrue(t.tryGetColumn("Display").nullable());
    assertTrue(t.tryGetColumn("Version").computed());
    assertEquals(List.of(id), t.primaryKeyColumns());

    TableOrViewMetadata<SqlServerObjectName> v = md.getTableOrView(md.parseObjectName("ActiveCustomer"));
    assertFalse(v.isTable());
    assertTrue(v.primaryKeyColumns().isEmpty());
  }

  @Test
  void unknownTablesAreErrorsAndAreNotRequeried() {
    SqlServerObjectName missing = md.parseObjectName("sales.Nope");
    assertThrows(MissingObjectException.class, () -> md.getTableOrView(missing));
    assertThrows(MissingObjectException.class, () -> md.getTableOrView(md.parseObjectName("[Sales].[NOPE]")));
    assertNull(md.tryGetTableOrView(missing));
    assertEquals(List.of(SqlServerMetadataCache.FIND_OBJECT), catalog.executed);
  }

  @Test
  void readsStoredProcedureParameters() {
    StoredProcedureMetadata<SqlServerObjectName> p = md.getStoredProcedure(md.parseObjectName("renamecustomer"));
    assertEquals(new SqlServerObjectName("dbo", "RenameCustomer"), p.name());
    assertEquals(List.of("Id", "Name", "Previous"), p.parameters().stream().map(ParameterMetadata::clrName).toList());
    assertEquals("@Previous", p.parameters().get(2).sqlParameterName());
    assertTrue(p.parameters().get(2).output());
    assertSame(p, md.getStoredProcedure(md.parseObjectName("dbo.RenameCustomer")));

    assertNull(md.getStoredProcedure(md.parseObjectName("Nope")));
    assertNull(md.getStoredProcedure(md.parseObjectName("nope")));
    assertEquals(3, catalog.executed.size());
  }

  @Test
  void readsTableFunctions() {
    TableOrViewMetadata<SqlServerObjectName> f = md.getTableFunction(md.parseObjectName("CustomersByName"));
    assertFalse(f.isTable());
    assertEquals(2, f.columns().size());
    assertNull(md.getTableFunction(md.parseObjectName("Customer")));
  }

  @Test
  void preloadsTablesAndViews() {
    md.preloadTables();
    md.preloadViews();
    assertEquals(2, md.cachedTablesAndViews().size());
  }

  @Test
  void buildsStatementsFromDiscoveredColumns() {
    SqlCommandBuilder<SqlServerObjectName> builder = new SqlCommandBuilder<>(dialect, md, true);
    Materializers m = new Materializers(md.types(), new CompiledBinderCache(), false);

    ExecutionToken insert = builder.prepareInsert(new InsertDescriptor("Customer", new Customer(0, "Ada")),
        m.toScalar(Integer.class, "Id"));
    assertEquals("INSERT INTO [dbo].[Customer] ([Name]) OUTPUT Inserted.[Id] VALUES (?)", insert.commandText());
    assertTrue(insert.returnsRows());

    ExecutionToken update = builder.prepareUpdate(UpdateDescriptor.byKey("Customer", new Customer(7, "Grace")),
        m.rowsAffected());
    assertEquals("UPDATE [dbo].[Customer] SET [Name] = ? WHERE [Id] = ?", update.commandText());
    assertEquals(1, update.expectedRowCount());

    ExecutionToken upsert = builder.prepareUpsert(UpsertDescriptor.of("Customer", new Customer(7, "Grace")),
        m.rowsAffected());
    assertTrue(upsert.commandText().startsWith("MERGE INTO [dbo].[Customer]"), upsert.commandText());
    assertTrue(upsert.commandText().contains("WHEN NOT MATCHED THEN INSERT ([Name]) VALUES (source.[Name])"),
        upsert.commandText());
  }
}
