package io.intellixity.sqlchain.reflect;

import io.intellixity.sqlchain.MappingException;

import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.*;

/**
 * Property and constructor descriptors of one mapped type, derived once by reflection.\n
 *
 * Records expose their components as read-only properties and their canonical constructor.
 */
public final class ClassMetadata {
  private final Class<?> type;
  private final List<PropertyMetadata> properties;
  private final Map<String, PropertyMetadata> byName;
  private final Map<String, PropertyMetadata> byColumn;
  private final Constructor<?> defaultConstructor;
  private final List<Constructor<?>> candidateConstructors;

  ClassMetadata(Class<?> type) {
    this.type = Objects.requireNonNull(type, "type");
    this.properties = List.copyOf(scan(type));

    Map<String, PropertyMetadata> names = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    Map<String, PropertyMetadata> columns = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (PropertyMetadata p : properties) {
      names.put(p.name(), p);
      if (p.mappedColumnName() != null) columns.putIfAbsent(p.mappedColumnName(), p);
    }
    this.byName = Collections.unmodifiableMap(names);
    this.byColumn = Collections.unmodifiableMap(columns);

    Constructor<?> noArgs = null;
    List<Constructor<?>> candidates = new ArrayList<>();
    for (Constructor<?> c : type.getDeclaredConstructors()) {
      if (c.isSynthetic()) continue;
      if (c.getParameterCount() == 0) {
        noArgs = c;
      } else if (Modifier.isPublic(c.getModifiers()) || type.isRecord()) {
        candidates.add(c);
      }
    }
    if (noArgs != null) noArgs.setAccessible(true);
    this.defaultConstructor = noArgs;
    this.candidateConstructors = List.copyOf(candidates);
  }

  public Class<?> type() { return type; }

  /** Properties in a stable order (declaration order for records, name order for beans). */
  public List<PropertyMetadata> properties() { return properties; }

  /** Case-insensitive lookup by property name, or {@code null}. */
  public PropertyMetadata property(String name) { return byName.get(name); }

  /** Case-insensitive lookup by mapped column name, or {@code null}. */
  public PropertyMetadata propertyForColumn(String columnName) { return byColumn.get(columnName); }

  public boolean hasDefaultConstructor() { return defaultConstructor != null; }

  public Object newInstance() {
    if (defaultConstructor == null) {
      throw new MappingException("Type " + type.getName() + " has no default constructor");
    }
    try {
      return defaultConstructor.newInstance();
    } catch (ReflectiveOperationException e) {
      throw new MappingException("Cannot create an instance of " + type.getName(), e);
    }
  }

  /**
   * The one constructor with parameters that a row can be bound to.\n
   * Records use their canonical constructor.
   */
  public ConstructorMetadata inferConstructor() {
    if (type.isRecord()) {
      RecordComponent[] rc = type.getRecordComponents();
      Class<?>[] types = new Class<?>[rc.length];
      List<String> names = new ArrayList<>(rc.length);
      for (int i = 0; i < rc.length; i++) {
        types[i] = rc[i].getType();
        names.add(rc[i].getName());
      }
      try {
        return new ConstructorMetadata(type.getDeclaredConstructor(types), names);
      } catch (NoSuchMethodException e) {
        throw new MappingException("Record " + type.getName() + " has no canonical constructor", e);
      }
    }
    if (candidateConstructors.isEmpty()) {
      throw new MappingException("Type " + type.getName() + " has no non-default constructor to infer");
    }
    if (candidateConstructors.size() > 1) {
      throw new MappingException("Type " + type.getName() + " has " + candidateConstructors.size()
          + " non-default constructors; cannot infer which one to use");
    }
    return ConstructorMetadata.of(candidateConstructors.get(0));
  }

  /**
   * Column names this type can be populated from, decomposed properties flattened with their prefix.\n
   * Only writable properties count, except on records.
   */
  public List<String> columnsFor(ClassMetadataCache cache) {
    Set<String> out = new LinkedHashSet<>();
    collectColumns(cache, "", out, new HashSet<>());
    return List.copyOf(out);
  }

  private void collectColumns(ClassMetadataCache cache, String prefix, Set<String> out, Set<Class<?>> visiting) {
    if (!visiting.add(type)) {
      throw new MappingException("Decomposition cycle through " + type.getName());
    }
    for (PropertyMetadata p : properties) {
      if (p.decompose()) {
        cache.get(p.propertyType()).collectColumns(cache, prefix + p.decompositionPrefix(), out, visiting);
      } else if (p.mappedColumnName() != null && (p.canWrite() || type.isRecord())) {
        out.add(prefix + p.mappedColumnName());
      }
    }
    visiting.remove(type);
  }

  private static List<PropertyMetadata> scan(Class<?> type) {
    List<PropertyMetadata> out = new ArrayList<>();
    if (type.isRecord()) {
      for (RecordComponent rc : type.getRecordComponents()) {
        out.add(new PropertyMetadata(type, rc.getName(), rc.getType(), rc.getAccessor(), null));
      }
      return out;
    }
    try {
      BeanInfo info = Introspector.getBeanInfo(type, Object.class);
      for (PropertyDescriptor pd : info.getPropertyDescriptors()) {
        if (pd.getPropertyType() == null) continue; // indexed-only property
        out.add(new PropertyMetadata(type, pd.getName(), pd.getPropertyType(), pd.getReadMethod(), pd.getWriteMethod()));
      }
    } catch (IntrospectionException e) {
      throw new MappingException("Unable to introspect properties for " + type.getName(), e);
    }
    return out;
  }
}
