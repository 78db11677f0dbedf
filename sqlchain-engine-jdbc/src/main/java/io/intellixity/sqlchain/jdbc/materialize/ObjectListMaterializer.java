package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Every row as an object of {@code T}. */
public final class ObjectListMaterializer<T> implements Materializer<List<T>> {
  private final Materializers materializers;
  private final Class<T> type;
  private final ConstructorMetadata constructor;
  private final DesiredColumns desired;

  ObjectListMaterializer(Materializers materializers, Class<T> type, Set<CollectionOptions> options) {
    this.materializers = materializers;
    this.type = type;
    this.constructor = materializers.constructorFor(type, options.contains(CollectionOptions.INFER_CONSTRUCTOR));
    this.desired = materializers.desiredColumnsFor(type, constructor);
  }

  @Override
  public DesiredColumns desiredColumns() {
    return desired;
  }

  @Override
  public List<T> fromRows(ExecutionToken source, RowCursor rows) {
    RowBinder<T> binder = materializers.binderFor(source, type, constructor, rows);
    List<T> out = new ArrayList<>();
    while (rows.next()) out.add(binder.bind(rows));
    return out;
  }
}
