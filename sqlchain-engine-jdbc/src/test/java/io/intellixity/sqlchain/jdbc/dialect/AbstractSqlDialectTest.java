package io.intellixity.sqlchain.jdbc.dialect;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.annotation.Decompose;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.ColumnValue;
import io.intellixity.sqlchain.jdbc.dialect.AbstractSqlDialect.Rendered;
import io.intellixity.sqlchain.metadata.ColumnMetadata;
import io.intellixity.sqlchain.metadata.TableOrViewMetadata;
import io.intellixity.sqlchain.op.FilterOptions;
import io.intellixity.sqlchain.op.LimitOptions;
import io.intellixity.sqlchain.op.Limits;
import io.intellixity.sqlchain.op.SortExpression;
import io.intellixity.sqlchain.op.ValueFilter;
import io.intellixity.sqlchain.op.WhereClauseFilter;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.CommandParameter;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.sqlchain.jdbc.dialect.StaticCatalog.col;
import static io.intellixity.sqlchain.jdbc.dialect.StaticCatalog.identity;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDialectTest {
  public static class Geo {
    private String city;
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
  }

  public static class NameFilter {
    private String name;
    @Decompose("Home")
    private Geo home;
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Geo getHome() { return home; }
    public void setHome(Geo home) { this.home = home; }
  }

  private final ClassMetadataCache types = new ClassMetadataCache();
  private final TestDialect dialect = new TestDialect(StaticCatalog::new);
  private final ColumnMetadata id = identity("Id", "int");
  private final ColumnMetadata name = col("Name", "text");
  private final ColumnMetadata score = col("Score", "int");
  private final TableOrViewMetadata<String> customer =
      new TableOrViewMetadata<>("Customer", true, List.of(id, name, score, col("HomeCity", "text")), types);

  @Test
  void selectWithoutColumnsSelectsStar() {
    Rendered r = dialect.renderSelect(customer, List.of(), null, List.of(), Limits.NONE);
    assertEquals("SELECT * FROM \"Customer\"", r.sql());
    assertTrue(r.parameters().isEmpty());
  }

  @Test
  void selectCombinesFilterSortAndPaging() {
    Rendered where = dialect.renderFilter(customer, new ValueFilter(Map.of("name", "Ada"), FilterOptions.NONE), types);
    Rendered r = dialect.renderSelect(customer, List.of(id, name), where,
        List.of(SortExpression.desc("score"), SortExpression.asc("Id")), new Limits(10, 5, LimitOptions.ROWS, null));
    assertEquals("SELECT \"Id\", \"Name\" FROM \"Customer\" WHERE \"Name\" = ? ORDER BY \"Score\" DESC, \"Id\" ASC"
        + " LIMIT 5 OFFSET 10", r.sql());
    assertEquals(List.of(new CommandParameter("Name", "Ada")), r.parameters());
  }

  @Test
  void sortingByAnUnknownColumnFails() {
    MappingException e = assertThrows(MappingException.class, () ->
        dialect.renderSelect(customer, List.of(), null, List.of(SortExpression.asc("Nope")), Limits.NONE));
    assertTrue(e.getMessage().contains("Nope"));
  }

  @Test
  void invalidPagingCombinationsAreRejected() {
    assertThrows(IllegalArgumentException.class, () ->
        dialect.renderSelect(customer, List.of(), null, List.of(), new Limits(1, 5, LimitOptions.TOP, null)));
    assertThrows(IllegalArgumentException.class, () ->
        dialect.renderSelect(customer, List.of(), null, List.of(), new Limits(1, 5, LimitOptions.RANDOM_SAMPLE_ROWS, null)));
    assertThrows(IllegalArgumentException.class, () ->
        dialect.renderSelect(customer, List.of(), null, List.of(), new Limits(null, null, LimitOptions.TOP, null)));
    assertThrows(IllegalArgumentException.class, () ->
        dialect.renderSelect(customer, List.of(), null, List.of(SortExpression.asc("Id")),
            new Limits(null, 3, LimitOptions.RANDOM_SAMPLE_ROWS, null)));
  }

  @Test
  void randomSamplingOrdersRandomly() {
    Rendered r = dialect.renderSelect(customer, List.of(id), null, List.of(),
        new Limits(null, 3, LimitOptions.RANDOM_SAMPLE_ROWS, null));
    assertEquals("SELECT \"Id\" FROM \"Customer\" ORDER BY RANDOM() LIMIT 3", r.sql());
  }

  @Test
  void valueFiltersTurnNullsIntoIsNullUnlessIgnored() {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("Name", "Ada");
    filter.put("Score", null);
    filter.put("NotAColumn", 1);

    Rendered r = dialect.renderFilter(customer, new ValueFilter(filter, FilterOptions.NONE), types);
    assertEquals("\"Name\" = ? AND \"Score\" IS NULL", r.sql());
    assertEquals(1, r.parameters().size());

    Rendered ignored = dialect.renderFilter(customer, new ValueFilter(filter, FilterOptions.IGNORE_NULL_PROPERTIES), types);
    assertEquals("\"Name\" = ?", ignored.sql());
  }

  @Test
  void valueFiltersLeftWithoutTermsFail() {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("Score", null);
    filter.put("NotAColumn", 1);
    MappingException e = assertThrows(MappingException.class,
        () -> dialect.renderFilter(customer, new ValueFilter(filter, FilterOptions.IGNORE_NULL_PROPERTIES), types));
    assertTrue(e.getMessage().contains("is null"), e.getMessage());

    assertThrows(MappingException.class, () -> dialect.renderFilter(customer,
        new ValueFilter(new NameFilter(), FilterOptions.IGNORE_NULL_PROPERTIES), types));
    assertEquals("\"Score\" IS NULL",
        dialect.renderFilter(customer, new ValueFilter(filter, FilterOptions.NONE), types).sql());
  }

  @Test
  void objectFiltersFlattenDecomposedProperties() {
    NameFilter f = new NameFilter();
    f.setName("Ada");
    f.setHome(new Geo());
    f.getHome().setCity("Oslo");
    Rendered r = dialect.renderFilter(customer, new ValueFilter(f, FilterOptions.NONE), types);
    assertEquals("\"HomeCity\" = ? AND \"Name\" = ?", r.sql());
    assertEquals(List.of("Oslo", "Ada"), r.parameters().stream().map(CommandParameter::value).toList());
  }

  @Test
  void filterWithoutMatchingColumnsFails() {
    MappingException e = assertThrows(MappingException.class, () ->
        dialect.renderFilter(customer, new ValueFilter(Map.of("Other", 1), FilterOptions.NONE), types));
    assertEquals("Unable to find any properties on type Map that match the columns on Customer", e.getMessage());
  }

  @Test
  void whereClauseFiltersBindNamedParameters() {
    Rendered r = dialect.renderFilter(customer, new WhereClauseFilter("Score > :min", Map.of("min", 3)), types);
    assertEquals("Score > ?", r.sql());
    assertEquals(3, r.parameters().get(0).value());
    assertNull(dialect.renderFilter(customer, null, types));
  }

  @Test
  void insertRendersColumnsOrDefaultValues() {
    Rendered r = dialect.renderInsert(customer, List.of(new ColumnValue(name, "Ada"), new ColumnValue(score, 3)),
        List.of(id));
    assertEquals("INSERT INTO \"Customer\" (\"Name\", \"Score\") VALUES (?, ?) RETURNING \"Id\"", r.sql());
    assertEquals(2, r.parameters().size());
    assertEquals("INSERT INTO \"Customer\" DEFAULT VALUES",
        dialect.renderInsert(customer, List.of(), List.of()).sql());
  }

  @Test
  void updateAndDeleteOmitWhereForAllRows() {
    Rendered set = dialect.renderSetClause(List.of(new ColumnValue(score, 0)));
    assertEquals("UPDATE \"Customer\" SET \"Score\" = ?", dialect.renderUpdate(customer, set, null).sql());
    Rendered where = dialect.renderKeyPredicate(List.of(new ColumnValue(id, 7)));
    Rendered update = dialect.renderUpdate(customer, set, where);
    assertEquals("UPDATE \"Customer\" SET \"Score\" = ? WHERE \"Id\" = ?", update.sql());
    assertEquals(List.of(0, 7), update.parameters().stream().map(CommandParameter::value).toList());
    assertEquals("DELETE FROM \"Customer\"", dialect.renderDelete(customer, null).sql());
    assertEquals("DELETE FROM \"Customer\" WHERE \"Id\" = ?", dialect.renderDelete(customer, where).sql());
    assertThrows(IllegalArgumentException.class, () -> dialect.renderSetClause(List.of()));
  }
}
