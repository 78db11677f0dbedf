package io.intellixity.sqlchain.metadata;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.reflect.ClassMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.PropertyMetadata;
import io.intellixity.sqlchain.util.Lazy;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A table or view and its columns.\n
 *
 * Column order is catalog discovery order; lookups by name ignore case.\n
 * Column-to-property maps are computed once per (type, filter) and kept for the life of this object.
 *
 * @param <N> the dialect's object name type
 */
public final class TableOrViewMetadata<N> {
  private final N name;
  private final boolean table;
  private final List<ColumnMetadata> columns;
  private final Map<String, ColumnMetadata> columnsByName;
  private final ClassMetadataCache types;
  private final ConcurrentHashMap<MapKey, Lazy<List<ColumnPropertyMap>>> propertyMaps = new ConcurrentHashMap<>();

  private record MapKey(Class<?> type, Set<PropertiesFilter> filter) {}

  public TableOrViewMetadata(N name, boolean table, List<ColumnMetadata> columns, ClassMetadataCache types) {
    this.name = Objects.requireNonNull(name, "name");
    this.table = table;
    this.columns = List.copyOf(columns);
    this.types = Objects.requireNonNull(types, "types");

    Map<String, ColumnMetadata> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (ColumnMetadata c : this.columns) {
      if (byName.putIfAbsent(c.sqlName(), c) != null) {
        throw new IllegalArgumentException("Duplicate column " + c.sqlName() + " on " + name);
      }
    }
    this.columnsByName = Collections.unmodifiableMap(byName);
  }

  public N name() { return name; }

  public boolean isTable() { return table; }

  public List<ColumnMetadata> columns() { return columns; }

  /** Case-insensitive column lookup, or {@code null} when the column does not exist. */
  public ColumnMetadata tryGetColumn(String columnName) {
    if (columnName == null) return null;
    return columnsByName.get(columnName);
  }

  public List<ColumnMetadata> primaryKeyColumns() {
    return columns.stream().filter(ColumnMetadata::primaryKey).toList();
  }

  public List<ColumnPropertyMap> getPropertiesFor(Class<?> type) {
    return getPropertiesFor(type, Set.of());
  }

  /**
   * Columns of this object joined with the properties of {@code type}, narrowed by {@code filter}.\n
   * The same list instance is returned for the same key.
   */
  public List<ColumnPropertyMap> getPropertiesFor(Class<?> type, Set<PropertiesFilter> filter) {
    Objects.requireNonNull(type, "type");
    MapKey key = new MapKey(type, Set.copyOf(filter));
    // lazy holder: filtered maps recurse into this map for the unfiltered join
    return propertyMaps.computeIfAbsent(key, k -> new Lazy<>(() -> compute(k))).get();
  }

  private List<ColumnPropertyMap> compute(MapKey key) {
    if (key.filter().isEmpty()) return join(key.type());

    Set<PropertiesFilter> f = key.filter();
    List<ColumnPropertyMap> all = getPropertiesFor(key.type(), Set.of());
    List<ColumnPropertyMap> out = new ArrayList<>(all.size());
    for (ColumnPropertyMap m : all) {
      if (f.contains(PropertiesFilter.PRIMARY_KEY) && !m.column().primaryKey()) continue;
      if (f.contains(PropertiesFilter.NON_PRIMARY_KEY) && m.column().primaryKey()) continue;
      if (f.contains(PropertiesFilter.OBJECT_DEFINED_KEY) && !m.property().isKey()) continue;
      if (f.contains(PropertiesFilter.OBJECT_DEFINED_NON_KEY) && m.property().isKey()) continue;
      if (f.contains(PropertiesFilter.UPDATABLE_ONLY) && !m.column().updatable()) continue;
      out.add(m);
    }

    if (f.contains(PropertiesFilter.PRIMARY_KEY) && f.contains(PropertiesFilter.THROW_ON_MISSING_PROPERTIES)) {
      Set<String> mapped = all.stream().map(m -> m.column().sqlName()).collect(Collectors.toSet());
      List<String> missing = primaryKeyColumns().stream()
          .map(ColumnMetadata::sqlName)
          .filter(c -> !mapped.contains(c))
          .toList();
      if (!missing.isEmpty()) {
        throw new MappingException("The type " + key.type().getSimpleName()
            + " is missing a property mapped to the primary key column(s): " + String.join(", ", missing)
            + " on table " + name);
      }
    }

    if (f.contains(PropertiesFilter.THROW_ON_MISSING_COLUMNS)) {
      List<String> missing = new ArrayList<>();
      for (PropertyMetadata p : types.get(key.type()).properties()) {
        if (p.mappedColumnName() != null && p.canRead() && tryGetColumn(p.mappedColumnName()) == null) {
          missing.add(p.name());
        }
      }
      if (!missing.isEmpty()) {
        throw new MappingException("The table " + name + " is missing a column mapped to the properties: "
            + String.join(", ", missing) + " on type " + key.type().getSimpleName()
            + ". Use @Column and/or @NotMapped to adjust the mapping.");
      }
    }

    if (out.isEmpty() && f.contains(PropertiesFilter.THROW_ON_NO_MATCH)) {
      throw new MappingException("None of the properties for " + key.type().getSimpleName()
          + " match the " + describe(f) + " columns for " + name);
    }
    return List.copyOf(out);
  }

  private List<ColumnPropertyMap> join(Class<?> type) {
    ClassMetadata cm = types.get(type);
    List<ColumnPropertyMap> out = new ArrayList<>();
    for (ColumnMetadata c : columns) {
      PropertyMetadata p = cm.propertyForColumn(c.sqlName());
      if (p != null) out.add(new ColumnPropertyMap(c, p));
    }
    return List.copyOf(out);
  }

  private static String describe(Set<PropertiesFilter> f) {
    List<String> parts = new ArrayList<>();
    if (f.contains(PropertiesFilter.PRIMARY_KEY)) parts.add("primary key");
    if (f.contains(PropertiesFilter.NON_PRIMARY_KEY)) parts.add("non-primary key");
    if (f.contains(PropertiesFilter.OBJECT_DEFINED_KEY)) parts.add("object-defined key");
    if (f.contains(PropertiesFilter.OBJECT_DEFINED_NON_KEY)) parts.add("object-defined non-key");
    if (f.contains(PropertiesFilter.UPDATABLE_ONLY)) parts.add("updatable");
    return parts.isEmpty() ? "available" : String.join(", ", parts);
  }

  @Override
  public String toString() {
    return (table ? "Table " : "View ") + name;
  }
}
