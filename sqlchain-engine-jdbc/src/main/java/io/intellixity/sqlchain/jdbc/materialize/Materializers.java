package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.reflect.ClassMetadataCache;
import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates materializers bound to a data source's type metadata and binder cache.\n
 *
 * With compilation on, binders come from {@link CompiledBinderCache} keyed by statement text and type;
 * with it off, every execution uses an {@link InterpretedRowBinder}.
 */
public final class Materializers {
  private final ClassMetadataCache types;
  private final CompiledBinderCache binders;
  private final boolean compiled;

  public Materializers(ClassMetadataCache types, CompiledBinderCache binders, boolean compiled) {
    this.types = Objects.requireNonNull(types, "types");
    this.binders = Objects.requireNonNull(binders, "binders");
    this.compiled = compiled;
  }

  public ClassMetadataCache types() { return types; }

  public CompiledBinderCache binders() { return binders; }

  public boolean compiled() { return compiled; }

  public <T> ObjectListMaterializer<T> toList(Class<T> type, CollectionOptions... options) {
    return new ObjectListMaterializer<>(this, type, options.length == 0
        ? EnumSet.noneOf(CollectionOptions.class) : EnumSet.of(options[0], options));
  }

  public <T> ObjectMaterializer<T> toObject(Class<T> type, RowOptions... options) {
    return new ObjectMaterializer<>(this, type, options.length == 0
        ? EnumSet.noneOf(RowOptions.class) : EnumSet.of(options[0], options));
  }

  /** The only column of every row. */
  public <T> ColumnListMaterializer<T> toColumnList(Class<T> type, ListOptions... options) {
    return new ColumnListMaterializer<>(Objects.requireNonNull(type, "type"), null, setOf(ListOptions.class, options));
  }

  public <T> ColumnListMaterializer<T> toColumnList(Class<T> type, String columnName, ListOptions... options) {
    return new ColumnListMaterializer<>(Objects.requireNonNull(type, "type"),
        Objects.requireNonNull(columnName, "columnName"), setOf(ListOptions.class, options));
  }

  public ColumnListMaterializer<Integer> toIntList(String columnName, ListOptions... options) {
    return toColumnList(Integer.class, columnName, options);
  }

  public ColumnListMaterializer<Long> toLongList(String columnName, ListOptions... options) {
    return toColumnList(Long.class, columnName, options);
  }

  public ColumnListMaterializer<String> toStringList(String columnName, ListOptions... options) {
    return toColumnList(String.class, columnName, options);
  }

  /** Rows of {@code type} keyed by the value of {@code keyColumn}, which need not be mapped on the type. */
  public <K, V> KeyedMapMaterializer<K, V> toMap(String keyColumn, Class<K> keyType, Class<V> type,
                                                 DictionaryOptions... options) {
    return new KeyedMapMaterializer<>(this, Objects.requireNonNull(type, "type"),
        Objects.requireNonNull(keyColumn, "keyColumn"), Objects.requireNonNull(keyType, "keyType"), null,
        setOf(DictionaryOptions.class, options));
  }

  public <K, V> KeyedMapMaterializer<K, V> toMap(Function<? super V, ? extends K> keyFunction, Class<V> type,
                                                 DictionaryOptions... options) {
    return new KeyedMapMaterializer<>(this, Objects.requireNonNull(type, "type"), null, null,
        Objects.requireNonNull(keyFunction, "keyFunction"), setOf(DictionaryOptions.class, options));
  }

  public MapListMaterializer toMaps() {
    return new MapListMaterializer();
  }

  /** First column of the first row. */
  public <T> ScalarMaterializer<T> toScalar(Class<T> type) {
    return new ScalarMaterializer<>(type, null);
  }

  public <T> ScalarMaterializer<T> toScalar(Class<T> type, String columnName) {
    return new ScalarMaterializer<>(type, Objects.requireNonNull(columnName, "columnName"));
  }

  public RowsAffectedMaterializer rowsAffected() {
    return new RowsAffectedMaterializer();
  }

  private static <E extends Enum<E>> Set<E> setOf(Class<E> type, E[] values) {
    Set<E> out = EnumSet.noneOf(type);
    out.addAll(Arrays.asList(values));
    return out;
  }

  /** Constructor rows of {@code type} bind through, or {@code null} for setter binding. Records always use theirs. */
  ConstructorMetadata constructorFor(Class<?> type, boolean infer) {
    if (!infer && !type.isRecord()) return null;
    return types.get(type).inferConstructor();
  }

  DesiredColumns desiredColumnsFor(Class<?> type, ConstructorMetadata constructor) {
    List<String> names = (constructor != null)
        ? constructor.parameterNames()
        : types.get(type).columnsFor(types);
    return names.isEmpty() ? DesiredColumns.all() : DesiredColumns.of(names);
  }

  <T> RowBinder<T> binderFor(ExecutionToken source, Class<T> type, ConstructorMetadata constructor, RowCursor shape) {
    if (!compiled) return new InterpretedRowBinder<>(types, type, constructor);
    BinderKey key = new BinderKey(source.commandText(), type, constructor != null);
    return binders.getOrCompile(key,
        () -> CompiledRowBinder.compile(types, type, constructor, shape),
        () -> new InterpretedRowBinder<>(types, type, constructor));
  }
}
