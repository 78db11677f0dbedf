package io.intellixity.sqlchain.jdbc.sqlite;

import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.ColumnValue;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.Rendered;
import io.intellixity.sqlchain.jdbc.dialect.DialectRegistry;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.LimitOptions;
import io.intellixity.sqlchain.op.Limits;
import io.intellixity.sqlchain.op.SortExpression;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private final SqliteDialect dialect = new SqliteDialect();
  private final ColumnMetadata id = new ColumnMetadata("Id", "\"Id\"", "INTEGER", true, true, false, false);
  private final ColumnMetadata name = new ColumnMetadata("Name", "\"Name\"", "TEXT", false, false, false, false);
  private final TableOrViewMetadata<String> customer =
      new TableOrViewMetadata<>("Customer", true, List.of(id, name), new ClassMetadataCache());
  private final TableOrViewMetadata<String> activeCustomer =
      new TableOrViewMetadata<>("ActiveCustomer", false, List.of(id, name), new ClassMetadataCache());

  private String select(TableOrViewMetadata<String> table, List<SortExpression> sort, Limits limits) {
    return dialect.renderSelect(table, List.of(), null, sort, limits).sql();
  }

  @Test
  void registeredUnderSqlite() {
    assertInstanceOf(SqliteDialect.class, new DialectRegistry().dialect("SQLite"));
  }

  @Test
  void quotesWithDoubleQuotes() {
    assertEquals("\"a\"\"b\"", dialect.quoteIdent("a\"b"));
    assertEquals("\"Customer\"", dialect.quoteObjectName("Customer"));
  }

  @Test
  void pagesWithLimitAndOffset() {
    assertEquals("SELECT * FROM \"Customer\" LIMIT 5 OFFSET 10", select(customer, List.of(), new Limits(10, 5, null, null)));
    assertEquals("SELECT * FROM \"Customer\" LIMIT -1 OFFSET 10", select(customer, List.of(), new Limits(10, null, null, null)));
    assertEquals("SELECT * FROM \"Customer\" LIMIT 3", select(customer, List.of(), new Limits(null, 3, LimitOptions.TOP, null)));
    assertEquals("SELECT * FROM \"Customer\" ORDER BY \"Id\" DESC LIMIT 2",
        select(customer, List.of(SortExpression.desc("id")), new Limits(null, 2, null, null)));
  }

  @Test
  void samplesRandomRows() {
    assertEquals("SELECT * FROM \"Customer\" ORDER BY RANDOM() LIMIT 4",
        select(customer, List.of(), new Limits(null, 4, LimitOptions.RANDOM_SAMPLE_ROWS, null)));
    assertEquals("SELECT * FROM \"Customer\" ORDER BY " + SqliteDialect.seededOrder(42) + " LIMIT 4",
        select(customer, List.of(), new Limits(null, 4, LimitOptions.RANDOM_SAMPLE_ROWS, 42)));
  }

  @Test
  void seedsDeriveBothRoundsOfTheRowidHash() {
    String round1 = "(((rowid | 378422192) - (rowid & 378422192)) % 2147483647 * 2013560776 % 2147483647)";
    assertEquals("(((" + round1 + " | 1690786946) - (" + round1 + " & 1690786946)) % 2147483647"
        + " * 1201721805 % 2147483647)", SqliteDialect.seededOrder(42));
    assertNotEquals(SqliteDialect.seededOrder(42), SqliteDialect.seededOrder(43));
    assertFalse(SqliteDialect.seededOrder(-7).contains("--"), SqliteDialect.seededOrder(-7));
  }

  @Test
  void rejectsSamplingItCannotExpress() {
    Limits seeded = new Limits(null, 4, LimitOptions.RANDOM_SAMPLE_ROWS, 7);
    assertThrows(IllegalArgumentException.class, () -> select(activeCustomer, List.of(), seeded));
    assertThrows(IllegalArgumentException.class, () -> select(customer, List.of(SortExpression.asc("Name")), seeded));
    assertThrows(IllegalArgumentException.class,
        () -> select(customer, List.of(), new Limits(1, 4, LimitOptions.RANDOM_SAMPLE_ROWS, null)));
  }

  @Test
  void upsertsWithOnConflict() {
    Rendered r = dialect.renderUpsert(customer, List.of(new ColumnValue(id, 5)), List.of(new ColumnValue(name, "Ada")),
        List.of(id, name));
    assertEquals("INSERT INTO \"Customer\" (\"Id\", \"Name\") VALUES (?, ?) ON CONFLICT (\"Id\")"
        + " DO UPDATE SET \"Name\" = EXCLUDED.\"Name\" RETURNING \"Id\", \"Name\"", r.sql());
    assertEquals(List.of(5, "Ada"), r.parameters().stream().map(p -> p.value()).toList());

    Rendered keysOnly = dialect.renderUpsert(customer, List.of(new ColumnValue(id, 5)), List.of(), List.of());
    assertEquals("INSERT INTO \"Customer\" (\"Id\") VALUES (?) ON CONFLICT (\"Id\") DO NOTHING", keysOnly.sql());
  }

  @Test
  void insertReturnsRequestedColumns() {
    Rendered r = dialect.renderInsert(customer, List.of(new ColumnValue(name, "Ada")), List.of(id));
    assertEquals("INSERT INTO \"Customer\" (\"Name\") VALUES (?) RETURNING \"Id\"", r.sql());
  }
}
