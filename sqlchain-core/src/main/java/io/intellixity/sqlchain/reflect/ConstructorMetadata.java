package io.intellixity.sqlchain.reflect;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A constructor whose parameters are bound from columns of the same name. */
public final class ConstructorMetadata {
  private final Constructor<?> constructor;
  private final List<String> parameterNames;
  private final List<Class<?>> parameterTypes;

  ConstructorMetadata(Constructor<?> constructor, List<String> parameterNames) {
    this.constructor = Objects.requireNonNull(constructor, "constructor");
    this.constructor.setAccessible(true);
    this.parameterNames = List.copyOf(parameterNames);
    this.parameterTypes = List.of(constructor.getParameterTypes());
  }

  static ConstructorMetadata of(Constructor<?> constructor) {
    List<String> names = new ArrayList<>();
    for (Parameter p : constructor.getParameters()) names.add(p.getName());
    return new ConstructorMetadata(constructor, names);
  }

  public List<String> parameterNames() { return parameterNames; }

  public List<Class<?>> parameterTypes() { return parameterTypes; }

  public Object newInstance(Object... args) {
    try {
      return constructor.newInstance(args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      throw new IllegalStateException("Constructor of " + constructor.getDeclaringClass().getName() + " failed", cause);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot invoke constructor of " + constructor.getDeclaringClass().getName(), e);
    }
  }
}
