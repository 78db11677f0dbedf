package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.ChangeTracking;
import io.intellixity.sqlchain.reflect.ClassMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.List;
import java.util.Objects;

/**
 * Binds rows by looking every column up by name on every row. No setup cost; used when compilation is
 * turned off or fails.
 */
public final class InterpretedRowBinder<T> implements RowBinder<T> {
  private final ClassMetadataCache types;
  private final Class<T> type;
  private final ClassMetadata metadata;
  private final ConstructorMetadata constructor;

  /** @param constructor constructor to bind through, or {@code null} to use the default constructor and setters */
  public InterpretedRowBinder(ClassMetadataCache types, Class<T> type, ConstructorMetadata constructor) {
    this.types = Objects.requireNonNull(types, "types");
    this.type = Objects.requireNonNull(type, "type");
    this.metadata = types.get(type);
    this.constructor = constructor;
  }

  @Override
  public T bind(RowCursor row) {
    Object target = (constructor != null) ? construct(row) : populate(row);
    if (target instanceof ChangeTracking ct) ct.acceptChanges();
    return type.cast(target);
  }

  private Object construct(RowCursor row) {
    List<String> names = constructor.parameterNames();
    List<Class<?>> paramTypes = constructor.parameterTypes();
    Object[] args = new Object[names.size()];
    for (int p = 0; p < args.length; p++) {
      int index = indexOf(row, names.get(p));
      Object raw = (index < 0) ? null : row.getObject(index);
      args[p] = ValueConverter.convert(raw, paramTypes.get(p));
    }
    return constructor.newInstance(args);
  }

  private Object populate(RowCursor row) {
    Object target = metadata.newInstance();
    for (int i = 0; i < row.fieldCount(); i++) {
      PropertyPath path = PropertyPath.resolve(types, metadata, row.name(i));
      if (path == null) continue;
      Object owner = path.owner(types, target);
      path.leaf().set(owner, ValueConverter.convert(row.getObject(i), path.leaf().propertyType()));
    }
    return target;
  }

  private static int indexOf(RowCursor row, String name) {
    for (int i = 0; i < row.fieldCount(); i++) {
      if (row.name(i).equalsIgnoreCase(name)) return i;
    }
    return -1;
  }
}
