package io.intellixity.sqlchain.reflect;

import io.intellixity.sqlchain.annotation.Column;
import io.intellixity.sqlchain.annotation.Decompose;
import io.intellixity.sqlchain.annotation.Key;
import io.intellixity.sqlchain.annotation.NotMapped;

import java.lang.annotation.Annotation;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Objects;

/**
 * One readable and/or writable property of a mapped type.\n
 *
 * Annotations are looked up on the getter, then the setter, then a declared field of the same name.
 */
public final class PropertyMetadata {
  private final String name;
  private final Class<?> propertyType;
  private final MethodHandle getter;
  private final MethodHandle setter;
  private final String mappedColumnName;
  private final boolean key;
  private final boolean decompose;
  private final String decompositionPrefix;

  PropertyMetadata(Class<?> owner, String name, Class<?> propertyType, Method readMethod, Method writeMethod) {
    this.name = Objects.requireNonNull(name, "name");
    this.propertyType = Objects.requireNonNull(propertyType, "propertyType");
    this.getter = unreflect(readMethod);
    this.setter = unreflect(writeMethod);

    Field field = findField(owner, name);
    Column column = annotation(Column.class, readMethod, writeMethod, field);
    Decompose dec = annotation(Decompose.class, readMethod, writeMethod, field);
    boolean notMapped = annotation(NotMapped.class, readMethod, writeMethod, field) != null;

    this.key = annotation(Key.class, readMethod, writeMethod, field) != null;
    this.decompose = dec != null;
    this.decompositionPrefix = dec == null ? null : dec.value();
    if (notMapped || decompose) {
      this.mappedColumnName = null;
    } else {
      this.mappedColumnName = column != null ? column.value() : name;
    }
  }

  public String name() { return name; }

  public Class<?> propertyType() { return propertyType; }

  public boolean canRead() { return getter != null; }

  public boolean canWrite() { return setter != null; }

  /** Column this property maps to, or {@code null} for not-mapped and decomposed properties. */
  public String mappedColumnName() { return mappedColumnName; }

  public boolean isKey() { return key; }

  public boolean decompose() { return decompose; }

  public String decompositionPrefix() { return decompositionPrefix; }

  /** True when a NULL column may be assigned as-is (reference types). */
  public boolean acceptsNull() { return !propertyType.isPrimitive(); }

  /** Getter handle typed {@code (Object)Object}. */
  public MethodHandle getterHandle() {
    if (getter == null) throw new IllegalStateException("Property " + name + " is not readable");
    return getter;
  }

  /** Setter handle typed {@code (Object,Object)void}. */
  public MethodHandle setterHandle() {
    if (setter == null) throw new IllegalStateException("Property " + name + " is not writable");
    return setter;
  }

  public Object get(Object target) {
    try {
      return getterHandle().invokeExact(target);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to read property " + name, t);
    }
  }

  public void set(Object target, Object value) {
    try {
      setterHandle().invokeExact(target, value);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to write property " + name, t);
    }
  }

  @Override
  public String toString() {
    return "PropertyMetadata[" + name + ":" + propertyType.getSimpleName() + "]";
  }

  private static MethodHandle unreflect(Method m) {
    if (m == null) return null;
    try {
      m.setAccessible(true);
      MethodHandle h = MethodHandles.lookup().unreflect(m);
      return h.asType(m.getParameterCount() == 0
          ? h.type().generic()
          : h.type().generic().changeReturnType(void.class));
    } catch (IllegalAccessException | RuntimeException e) {
      throw new IllegalStateException("Cannot access " + m, e);
    }
  }

  private static Field findField(Class<?> owner, String name) {
    for (Class<?> c = owner; c != null && c != Object.class; c = c.getSuperclass()) {
      try {
        return c.getDeclaredField(name);
      } catch (NoSuchFieldException ignored) {
        // keep walking up
      }
    }
    return null;
  }

  private static <A extends Annotation> A annotation(Class<A> type, Method read, Method write, Field field) {
    if (read != null && read.isAnnotationPresent(type)) return read.getAnnotation(type);
    if (write != null && write.isAnnotationPresent(type)) return write.getAnnotation(type);
    if (field != null && field.isAnnotationPresent(type)) return field.getAnnotation(type);
    return null;
  }
}
