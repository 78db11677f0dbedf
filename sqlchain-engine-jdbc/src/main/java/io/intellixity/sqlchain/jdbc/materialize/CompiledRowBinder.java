package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.ChangeTracking;
import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.reflect.ClassMetadata;
import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.reflect.PropertyMetadata;
import io.intellixity.sqlchain.spi.RowCursor;

import java.lang.invoke.MethodHandle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Binder specialized once for a row shape.\n
 *
 * Column positions, typed readers, null checks, conversions and setter handles are all resolved at compile
 * time; binding a row only runs the prepared steps. Columns without a matching property are dropped at
 * compile time.
 */
public final class CompiledRowBinder<T> implements RowBinder<T> {
  private final Class<T> type;
  private final ClassMetadata metadata;
  private final ConstructorMetadata constructor;
  private final Slot[] slots;
  private final Step[] steps;
  private final ClassMetadataCache types;

  private CompiledRowBinder(ClassMetadataCache types, Class<T> type, ConstructorMetadata constructor,
                            Slot[] slots, Step[] steps) {
    this.types = types;
    this.type = type;
    this.metadata = types.get(type);
    this.constructor = constructor;
    this.slots = slots;
    this.steps = steps;
  }

  /**
   * Compiles a binder for rows shaped like {@code shape}. Only the cursor's column names are inspected; its
   * position is not moved.
   */
  public static <T> CompiledRowBinder<T> compile(ClassMetadataCache types, Class<T> type,
                                                 ConstructorMetadata constructor, RowCursor shape) {
    Objects.requireNonNull(types, "types");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(shape, "shape");

    if (constructor != null) {
      Map<String, Integer> byName = new HashMap<>();
      for (int i = shape.fieldCount() - 1; i >= 0; i--) byName.put(shape.name(i).toLowerCase(Locale.ROOT), i);
      List<String> names = constructor.parameterNames();
      Slot[] slots = new Slot[names.size()];
      for (int p = 0; p < slots.length; p++) {
        Class<?> paramType = constructor.parameterTypes().get(p);
        Integer index = byName.get(names.get(p).toLowerCase(Locale.ROOT));
        slots[p] = (index == null)
            ? Slot.absent(paramType)
            : Slot.of(index, ColumnReader.forTarget(paramType), paramType);
      }
      return new CompiledRowBinder<>(types, type, constructor, slots, null);
    }

    ClassMetadata cm = types.get(type);
    if (!cm.hasDefaultConstructor()) {
      throw new MappingException("Type " + type.getName() + " has no default constructor");
    }
    List<Step> steps = new ArrayList<>();
    for (int i = 0; i < shape.fieldCount(); i++) {
      PropertyPath path = PropertyPath.resolve(types, cm, shape.name(i));
      if (path == null) continue;
      PropertyMetadata leaf = path.leaf();
      Slot slot = Slot.of(i, ColumnReader.forTarget(leaf.propertyType()), leaf.propertyType());
      steps.add(new Step(path.decomposed().isEmpty() ? null : path, slot, leaf.setterHandle()));
    }
    return new CompiledRowBinder<>(types, type, null, null, steps.toArray(new Step[0]));
  }

  @Override
  public T bind(RowCursor row) {
    Object target;
    if (constructor != null) {
      Object[] args = new Object[slots.length];
      for (int p = 0; p < slots.length; p++) args[p] = slots[p].read(row);
      target = constructor.newInstance(args);
    } else {
      target = metadata.newInstance();
      for (Step s : steps) s.apply(types, row, target);
    }
    if (target instanceof ChangeTracking ct) ct.acceptChanges();
    return type.cast(target);
  }

  int stepCount() {
    return (steps != null) ? steps.length : slots.length;
  }

  /** One value source: a column read with a fixed reader, or a constant default when the column is absent. */
  private static final class Slot {
    private final int index;
    private final ColumnReader reader;
    private final boolean nullCheck;
    private final boolean convert;
    private final Class<?> targetType;

    private Slot(int index, ColumnReader reader, boolean nullCheck, boolean convert, Class<?> targetType) {
      this.index = index;
      this.reader = reader;
      this.nullCheck = nullCheck;
      this.convert = convert;
      this.targetType = targetType;
    }

    static Slot of(int index, ColumnReader reader, Class<?> targetType) {
      boolean convert = reader.resultType() != ValueConverter.wrap(targetType);
      return new Slot(index, reader, !targetType.isPrimitive(), convert, targetType);
    }

    static Slot absent(Class<?> targetType) {
      return new Slot(-1, null, false, false, targetType);
    }

    Object read(RowCursor row) {
      if (index < 0) return ValueConverter.defaultValue(targetType);
      if (nullCheck && row.isNull(index)) return null;
      Object v = reader.read(row, index);
      return convert ? ValueConverter.convert(v, targetType) : v;
    }
  }

  private static final class Step {
    private final PropertyPath path;
    private final Slot slot;
    private final MethodHandle setter;

    Step(PropertyPath path, Slot slot, MethodHandle setter) {
      this.path = path;
      this.slot = slot;
      this.setter = setter;
    }

    void apply(ClassMetadataCache types, RowCursor row, Object target) {
      Object owner = (path == null) ? target : path.owner(types, target);
      Object value = slot.read(row);
      try {
        setter.invokeExact(owner, value);
      } catch (RuntimeException | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new MappingException("Failed to bind column " + row.name(slot.index), t);
      }
    }
  }
}
