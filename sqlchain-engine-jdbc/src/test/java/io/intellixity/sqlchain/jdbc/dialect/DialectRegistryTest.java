package io.intellixity.sqlchain.jdbc.dialect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DialectRegistryTest {
  private static SqlDialectProvider provider(String id, AbstractSqlDialect<?> dialect) {
    return new SqlDialectProvider() {
      @Override public String id() { return id; }
      @Override public AbstractSqlDialect<?> create() { return dialect; }
    };
  }

  @Test
  void discoversProvidersFromFactoriesFiles() {
    DialectRegistry registry = new DialectRegistry();
    assertTrue(registry.ids().contains("test"));
    assertInstanceOf(TestDialect.class, registry.dialect("TEST"));
  }

  @Test
  void firstRegistrationWinsAndIdsIgnoreCase() {
    TestDialect first = new TestDialect(StaticCatalog::new);
    TestDialect second = new TestDialect(StaticCatalog::new);
    DialectRegistry registry = new DialectRegistry(List.of(provider("Acme", first), provider("acme", second)));
    assertEquals(1, registry.ids().size());
    assertSame(first, registry.dialect(" ACME "));
  }

  @Test
  void unknownIdsListTheKnownOnes() {
    DialectRegistry registry = new DialectRegistry(List.of(provider("acme", new TestDialect(StaticCatalog::new))));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.dialect("oracle"));
    assertEquals("No dialect registered for id=oracle, known=[acme]", e.getMessage());
    assertThrows(IllegalArgumentException.class, () -> registry.dialect(" "));
  }
}
