package io.intellixity.sqlchain.reflect;

import io.intellixity.sqlchain.util.Lazy;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Append-only cache of {@link ClassMetadata}, one scan per type. */
public final class ClassMetadataCache {
  private final ConcurrentHashMap<Class<?>, Lazy<ClassMetadata>> types = new ConcurrentHashMap<>();

  public ClassMetadata get(Class<?> type) {
    Objects.requireNonNull(type, "type");
    return types.computeIfAbsent(type, t -> new Lazy<>(() -> new ClassMetadata(t))).get();
  }
}
