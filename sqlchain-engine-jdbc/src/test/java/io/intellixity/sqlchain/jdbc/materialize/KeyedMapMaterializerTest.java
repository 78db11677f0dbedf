package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.jdbc.materialize.Fixtures.Customer;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.MissingDataException;
import io.intellixity.sqlchain.spi.UnexpectedDataException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class KeyedMapMaterializerTest {
  private static final ExecutionToken SELECT =
      ExecutionToken.query("SELECT", "SELECT \"Id\", \"Name\" FROM \"Customer\"", List.of());

  private final Materializers materializers =
      new Materializers(new ClassMetadataCache(), new CompiledBinderCache(), true);

  private static Rows customers(Object... idsAndNames) {
    Rows r = Rows.of("Id", Integer.class, "Name", String.class);
    for (int i = 0; i < idsAndNames.length; i += 2) r.row(idsAndNames[i], idsAndNames[i + 1]);
    return r;
  }

  @Test
  void keyColumnIsConvertedAndRowOrderKept() {
    Map<Long, Customer> byId = materializers.toMap("Id", Long.class, Customer.class)
        .fromRows(SELECT, customers(2, "Grace", 1, "Ada").cursor());
    assertEquals(List.of(2L, 1L), List.copyOf(byId.keySet()));
    assertEquals("Ada", byId.get(1L).getName());
  }

  @Test
  void keyFunctionReadsTheBoundObject() {
    Map<String, Customer> byName = materializers.toMap(Customer::getName, Customer.class)
        .fromRows(SELECT, customers(1, "Ada", 2, "Grace").cursor());
    assertEquals(2, byName.get("Grace").getId());
  }

  @Test
  void keyColumnIsAddedToTheDesiredColumnsOnce() {
    assertEquals(1, materializers.toMap("ID", Integer.class, Customer.class).desiredColumns().names().stream()
        .filter("id"::equalsIgnoreCase).count());
  }

  @Test
  void duplicateKeysFailUnlessDiscarded() {
    UnexpectedDataException e = assertThrows(UnexpectedDataException.class,
        () -> materializers.toMap("Id", Integer.class, Customer.class)
            .fromRows(SELECT, customers(1, "Ada", 1, "Grace").cursor()));
    assertTrue(e.getMessage().contains("Duplicate key 1"), e.getMessage());

    Map<Integer, Customer> first = materializers.toMap("Id", Integer.class, Customer.class,
        DictionaryOptions.DISCARD_DUPLICATES).fromRows(SELECT, customers(1, "Ada", 1, "Grace").cursor());
    assertEquals("Ada", first.get(1).getName());
    assertEquals(1, first.size());
  }

  @Test
  void nullOrMissingKeysAreRejected() {
    assertThrows(MissingDataException.class, () -> materializers.toMap(Customer::getName, Customer.class)
        .fromRows(SELECT, customers(1, null).cursor()));

    MappingException e = assertThrows(MappingException.class,
        () -> materializers.toMap("Code", String.class, Customer.class)
            .fromRows(SELECT, customers(1, "Ada").cursor()));
    assertTrue(e.getMessage().contains("Key column Code"), e.getMessage());
  }
}
