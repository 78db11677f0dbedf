package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.UnexpectedDataException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnListMaterializerTest {
  private static final ExecutionToken SELECT =
      ExecutionToken.query("SELECT", "SELECT \"Id\", \"Score\" FROM \"Customer\"", List.of());

  private final Materializers materializers =
      new Materializers(new ClassMetadataCache(), new CompiledBinderCache(), true);

  private static Rows scores() {
    return Rows.of("Id", Integer.class, "Score", Long.class)
        .row(1, 10L)
        .row(2, null)
        .row(3, 5_000_000_000L);
  }

  @Test
  void namedColumnIsConvertedAndNullsAreKept() {
    ColumnListMaterializer<Long> m = materializers.toLongList("score");
    assertEquals(DesiredColumns.of("score"), m.desiredColumns());
    assertEquals(Arrays.asList(10L, null, 5_000_000_000L), m.fromRows(SELECT, scores().cursor()));
    assertEquals(List.of("1", "2", "3"), materializers.toStringList("Id").fromRows(SELECT, scores().cursor()));
  }

  @Test
  void ignoreNullsDropsNullEntries() {
    assertEquals(List.of(10L, 5_000_000_000L),
        materializers.toLongList("Score", ListOptions.IGNORE_NULLS).fromRows(SELECT, scores().cursor()));
  }

  @Test
  void unnamedColumnRequiresASingleColumnResult() {
    ColumnListMaterializer<Integer> m = materializers.toColumnList(Integer.class);
    assertTrue(m.desiredColumns().isAll());
    assertEquals(List.of(7, 8),
        m.fromRows(SELECT, Rows.of("Id", Long.class).row(7L).row(8L).cursor()));

    UnexpectedDataException e = assertThrows(UnexpectedDataException.class,
        () -> m.fromRows(SELECT, scores().cursor()));
    assertTrue(e.getMessage().contains("Expected one column but 2"), e.getMessage());
  }

  @Test
  void extraColumnsCanBeDiscardedOrFlattened() {
    assertEquals(List.of(1L, 2L, 3L),
        materializers.toColumnList(Long.class, ListOptions.DISCARD_EXTRA_COLUMNS).fromRows(SELECT, scores().cursor()));
    assertEquals(List.of(1L, 10L, 2L, 3L, 5_000_000_000L),
        materializers.toColumnList(Long.class, ListOptions.FLATTEN_EXTRA_COLUMNS, ListOptions.IGNORE_NULLS)
            .fromRows(SELECT, scores().cursor()));
  }

  @Test
  void conflictingOptionsAndMissingColumnsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> materializers.toColumnList(Long.class,
        ListOptions.FLATTEN_EXTRA_COLUMNS, ListOptions.DISCARD_EXTRA_COLUMNS));
    assertThrows(IllegalArgumentException.class,
        () -> materializers.toLongList("Score", ListOptions.FLATTEN_EXTRA_COLUMNS));

    MappingException e = assertThrows(MappingException.class,
        () -> materializers.toLongList("Balance").fromRows(SELECT, scores().cursor()));
    assertTrue(e.getMessage().contains("Balance"), e.getMessage());
  }
}
