package io.intellixity.sqlchain.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Finds provider classes registered in {@code META-INF/sqlchain.factories}.\n
 *
 * Every copy of the resource on the classpath is read as a Properties file; the value under a provider
 * interface's name lists implementation classes, comma-separated. A class named twice is loaded once, at its
 * first position in classpath order. Providers need a public no-arg constructor.
 */
public final class SqlchainFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(SqlchainFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/sqlchain.factories";

  private SqlchainFactoriesLoader() {}

  public static <T> List<T> load(Class<T> providerType) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return load(providerType, (cl != null) ? cl : SqlchainFactoriesLoader.class.getClassLoader());
  }

  public static <T> List<T> load(Class<T> providerType, ClassLoader cl) {
    Objects.requireNonNull(providerType, "providerType");
    Objects.requireNonNull(cl, "cl");
    Set<String> names = registeredNames(providerType.getName(), cl);
    List<T> providers = new ArrayList<>(names.size());
    for (String name : names) providers.add(instantiate(name, providerType, cl));
    if (log.isDebugEnabled()) log.debug("sqlchain.factories op=load provider={} classes={}", providerType.getName(), names);
    return providers;
  }

  static Set<String> registeredNames(String key, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read " + url, e);
      }
      names.addAll(split(p.getProperty(key)));
    }
    return names;
  }

  static List<String> split(String value) {
    if (value == null) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : value.split(",")) {
      if (!part.isBlank()) out.add(part.strip());
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + RESOURCE, e);
    }
  }

  private static <T> T instantiate(String className, Class<T> providerType, ClassLoader cl) {
    Class<?> c;
    try {
      c = Class.forName(className, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " names " + className + ", which is not on the classpath", e);
    }
    if (!providerType.isAssignableFrom(c)) {
      throw new IllegalStateException(className + " is registered as a " + providerType.getSimpleName()
          + " but does not implement it");
    }
    try {
      return providerType.cast(c.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create " + className + " through its no-arg constructor", e);
    }
  }
}
