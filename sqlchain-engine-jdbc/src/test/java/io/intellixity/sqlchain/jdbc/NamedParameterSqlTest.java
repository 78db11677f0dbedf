package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.annotation.Column;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.CommandParameter;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParameterSqlTest {
  public static class Args {
    private int minAge = 18;
    private String city = "Oslo";
    public int getMinAge() { return minAge; }
    @Column("HomeCity")
    public String getCity() { return city; }
  }

  @Test
  void replacesNamedParamsInOrderAndRebindsRepeats() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(
        "Age >= :min AND (Name = :name OR Alias = :NAME)", Map.of("min", 18, "name", "x"));
    assertEquals("Age >= ? AND (Name = ? OR Alias = ?)", c.sql());
    assertEquals(List.of(new CommandParameter("min", 18), new CommandParameter("name", "x"),
        new CommandParameter("NAME", "x")), c.parameters());
  }

  @Test
  void castsAndQuotedTextAreLeftAlone() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(
        "Created::date = :d AND Note <> 'it''s :literal'", Map.of("d", "2024-01-01"));
    assertEquals("Created::date = ? AND Note <> 'it''s :literal'", c.sql());
    assertEquals(1, c.parameters().size());
  }

  @Test
  void missingArgumentIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> NamedParameterSql.compile("Id = :id", Map.of()));
    assertEquals("Missing query param: id", e.getMessage());
  }

  @Test
  void nullValuedArgumentsStillBind() {
    Map<String, Object> args = new HashMap<>();
    args.put("v", null);
    NamedParameterSql.Compiled c = NamedParameterSql.compile("X = :v", args);
    assertNull(c.parameters().get(0).value());
  }

  @Test
  void objectArgumentsExposePropertyAndColumnNames() {
    Map<String, Object> args = NamedParameterSql.argumentsOf(new Args(), new ClassMetadataCache());
    assertEquals(18, args.get("minage"));
    assertEquals("Oslo", args.get("city"));
    assertEquals("Oslo", args.get("homecity"));
    assertTrue(NamedParameterSql.argumentsOf(null, new ClassMetadataCache()).isEmpty());
  }
}
