package io.intellixity.sqlchain.metadata;

import io.intellixity.sqlchain.MissingObjectException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseMetadataCacheTest {
  static final class FakeCatalog extends DatabaseMetadataCache<String> {
    final AtomicInteger discoveries = new AtomicInteger();
    final AtomicInteger failuresLeft = new AtomicInteger();
    final boolean strict;

    FakeCatalog(boolean strict) {
      this.strict = strict;
    }

    @Override public String parseObjectName(String name) { return name; }
    @Override protected boolean strictIntrospection() { return strict; }
    @Override protected String normalize(String name) { return name.toLowerCase(Locale.ROOT); }
    @Override protected List<String> listTableNames() { return List.of("users", "orders"); }
    @Override protected List<String> listViewNames() { return List.of("active_users"); }

    @Override
    protected TableOrViewMetadata<String> discoverTableOrView(String name) {
      discoveries.incrementAndGet();
      if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) throw new IllegalStateException("connection reset");
      if (name.equals("missing")) return null;
      try {
        Thread.sleep(20);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return newTableOrView(name, !name.startsWith("active"),
          List.of(new ColumnMetadata("Id", "\"Id\"", "int", true, false, false, false)));
    }
  }

  @Test
  void softCatalogReturnsNullForUnknownNamesAndRemembersIt() {
    FakeCatalog c = new FakeCatalog(false);
    assertNull(c.getTableOrView("missing"));
    assertNull(c.tryGetTableOrView("missing"));
    assertEquals(1, c.discoveries.get());
    assertNull(c.getStoredProcedure("anything"));
    assertNull(c.getTableFunction("anything"));
  }

  @Test
  void strictCatalogThrowsForUnknownNames() {
    FakeCatalog c = new FakeCatalog(true);
    MissingObjectException ex = assertThrows(MissingObjectException.class, () -> c.getTableOrView("missing"));
    assertEquals("missing", ex.objectName());
    assertNull(c.tryGetTableOrView("missing"));
  }

  @Test
  void namesAreNormalizedBeforeCaching() {
    FakeCatalog c = new FakeCatalog(false);
    assertSame(c.getTableOrView("Users"), c.getTableOrView("USERS"));
    assertEquals(1, c.discoveries.get());
  }

  @Test
  void preloadDiscoversEveryTableAndView() {
    FakeCatalog c = new FakeCatalog(false);
    c.preloadTables();
    c.preloadViews();
    assertEquals(3, c.cachedTablesAndViews().size());
    assertFalse(c.getTableOrView("active_users").isTable());
    assertEquals(3, c.discoveries.get());
  }

  @Test
  void concurrentCallersShareOneDiscovery() throws Exception {
    FakeCatalog c = new FakeCatalog(false);
    int threads = 12;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<TableOrViewMetadata<String>>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return c.getTableOrView("orders");
        }));
      }
      start.countDown();
      TableOrViewMetadata<String> first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<TableOrViewMetadata<String>> f : futures) assertSame(first, f.get(10, TimeUnit.SECONDS));
      assertEquals(1, c.discoveries.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void failedDiscoveryIsRetriedOnTheNextLookup() {
    FakeCatalog c = new FakeCatalog(true);
    c.failuresLeft.set(1);
    IllegalStateException first = assertThrows(IllegalStateException.class, () -> c.getTableOrView("users"));
    assertEquals("connection reset", first.getMessage());
    assertTrue(c.cachedTablesAndViews().isEmpty());

    TableOrViewMetadata<String> users = c.getTableOrView("users");
    assertEquals("users", users.name());
    assertSame(users, c.getTableOrView("USERS"));
    assertEquals(2, c.discoveries.get());
  }
}
