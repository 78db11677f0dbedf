package io.intellixity.sqlchain.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlchainFactoriesLoaderTest {
  public interface Greeter {
    String greet();
  }

  public interface Unlinked {}

  public interface Mismatched {}

  public static final class English implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class French implements Greeter {
    @Override public String greet() { return "bonjour"; }
  }

  @Test
  void loadsRegisteredProvidersOnceInOrder() {
    List<Greeter> greeters = SqlchainFactoriesLoader.load(Greeter.class, getClass().getClassLoader());
    assertEquals(List.of("hello", "bonjour"), greeters.stream().map(Greeter::greet).toList());
  }

  @Test
  void unregisteredTypesLoadNothing() {
    assertTrue(SqlchainFactoriesLoader.load(Runnable.class, getClass().getClassLoader()).isEmpty());
  }

  @Test
  void badRegistrationsNameTheClass() {
    IllegalStateException missing = assertThrows(IllegalStateException.class,
        () -> SqlchainFactoriesLoader.load(Unlinked.class, getClass().getClassLoader()));
    assertTrue(missing.getMessage().contains("NoSuchGreeter"), missing.getMessage());

    IllegalStateException wrongType = assertThrows(IllegalStateException.class,
        () -> SqlchainFactoriesLoader.load(Mismatched.class, getClass().getClassLoader()));
    assertTrue(wrongType.getMessage().contains("does not implement"), wrongType.getMessage());
  }

  @Test
  void splitsCommaSeparatedValues() {
    assertEquals(List.of("a.B", "c.D"), SqlchainFactoriesLoader.split(" a.B, ,c.D "));
    assertEquals(List.of(), SqlchainFactoriesLoader.split(null));
  }
}
