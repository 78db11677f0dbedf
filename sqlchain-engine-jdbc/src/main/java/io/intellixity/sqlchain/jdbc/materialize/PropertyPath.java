package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.reflect.ClassMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.PropertyMetadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Where a column lands in an object graph: the decomposed properties to walk, then the property to set.\n
 * Both binder tiers resolve columns through {@link #resolve}.
 */
record PropertyPath(List<PropertyMetadata> decomposed, PropertyMetadata leaf) {

  /** Path for {@code column}, or {@code null} when no writable property takes it. */
  static PropertyPath resolve(ClassMetadataCache types, ClassMetadata root, String column) {
    List<PropertyMetadata> path = new ArrayList<>();
    PropertyMetadata leaf = resolve(types, root, column, path, new HashSet<>());
    return (leaf == null) ? null : new PropertyPath(List.copyOf(path), leaf);
  }

  private static PropertyMetadata resolve(ClassMetadataCache types, ClassMetadata cm, String column,
                                          List<PropertyMetadata> path, Set<Class<?>> visiting) {
    if (!visiting.add(cm.type())) return null;
    try {
      PropertyMetadata direct = cm.propertyForColumn(column);
      if (direct != null && direct.canWrite()) return direct;

      for (PropertyMetadata p : cm.properties()) {
        if (!p.decompose() || !p.canRead()) continue;
        String prefix = p.decompositionPrefix();
        if (column.length() <= prefix.length() || !column.regionMatches(true, 0, prefix, 0, prefix.length())) {
          continue;
        }
        path.add(p);
        PropertyMetadata leaf = resolve(types, types.get(p.propertyType()), column.substring(prefix.length()), path, visiting);
        if (leaf != null) return leaf;
        path.remove(path.size() - 1);
      }
      return null;
    } finally {
      visiting.remove(cm.type());
    }
  }

  /** Walks the decomposed properties of {@code root}, creating missing children, and returns the leaf's owner. */
  Object owner(ClassMetadataCache types, Object root) {
    Object current = root;
    for (PropertyMetadata p : decomposed) {
      Object child = p.get(current);
      if (child == null) {
        if (!p.canWrite()) {
          throw new MappingException("Decomposed property " + p.name()
              + " is null and has no setter");
        }
        child = types.get(p.propertyType()).newInstance();
        p.set(current, child);
      }
      current = child;
    }
    return current;
  }
}
