package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.MissingDataException;
import io.intellixity.sqlchain.spi.RowCursor;
import io.intellixity.sqlchain.spi.UnexpectedDataException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Every row as an object of {@code V}, keyed by a column of the row or by a function of the object.\n
 *
 * The map keeps row order. A null key is {@link MissingDataException}; a repeated key is
 * {@link UnexpectedDataException} unless {@link DictionaryOptions#DISCARD_DUPLICATES} keeps the first row.
 */
public final class KeyedMapMaterializer<K, V> implements Materializer<Map<K, V>> {
  private final Materializers materializers;
  private final Class<V> type;
  private final String keyColumn;
  private final Class<K> keyType;
  private final Function<? super V, ? extends K> keyFunction;
  private final boolean discardDuplicates;
  private final ConstructorMetadata constructor;
  private final DesiredColumns desired;

  KeyedMapMaterializer(Materializers materializers, Class<V> type, String keyColumn, Class<K> keyType,
                       Function<? super V, ? extends K> keyFunction, Set<DictionaryOptions> options) {
    this.materializers = materializers;
    this.type = type;
    this.keyColumn = keyColumn;
    this.keyType = keyType;
    this.keyFunction = keyFunction;
    this.discardDuplicates = options.contains(DictionaryOptions.DISCARD_DUPLICATES);
    this.constructor = materializers.constructorFor(type, false);
    DesiredColumns forType = materializers.desiredColumnsFor(type, constructor);
    if (keyColumn != null && !forType.isAll()
        && forType.names().stream().noneMatch(keyColumn::equalsIgnoreCase)) {
      List<String> names = new ArrayList<>(forType.names());
      names.add(keyColumn);
      forType = DesiredColumns.of(names);
    }
    this.desired = forType;
  }

  @Override
  public DesiredColumns desiredColumns() {
    return desired;
  }

  @Override
  public Map<K, V> fromRows(ExecutionToken source, RowCursor rows) {
    int keyIndex = (keyColumn == null) ? -1 : indexOf(source, rows);
    RowBinder<V> binder = materializers.binderFor(source, type, constructor, rows);
    Map<K, V> out = new LinkedHashMap<>();
    while (rows.next()) {
      V value = binder.bind(rows);
      K key = (keyIndex >= 0) ? keyAt(rows, keyIndex) : keyFunction.apply(value);
      if (key == null) {
        throw new MissingDataException("A row of " + type.getSimpleName() + " has a null key"
            + (keyColumn == null ? "" : " in column " + keyColumn) + " from: " + source.commandText());
      }
      if (out.containsKey(key)) {
        if (discardDuplicates) continue;
        throw new UnexpectedDataException("Duplicate key " + key + " for " + type.getSimpleName()
            + " from: " + source.commandText());
      }
      out.put(key, value);
    }
    return out;
  }

  @SuppressWarnings("unchecked")
  private K keyAt(RowCursor rows, int index) {
    Object raw = rows.getObject(index);
    return (raw == null) ? null : (K) ValueConverter.convert(raw, keyType);
  }

  private int indexOf(ExecutionToken source, RowCursor rows) {
    for (int i = 0; i < rows.fieldCount(); i++) {
      if (rows.name(i).equalsIgnoreCase(keyColumn)) return i;
    }
    throw new MappingException("Key column " + keyColumn + " is not in the result of: " + source.commandText());
  }
}
