package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.reflect.ConstructorMetadata;
import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.MissingDataException;
import io.intellixity.sqlchain.spi.RowCursor;
import io.intellixity.sqlchain.spi.UnexpectedDataException;

import java.util.Set;

/**
 * Exactly one row as an object of {@code T}.\n
 * No row is {@link MissingDataException} and a second row is {@link UnexpectedDataException}, unless
 * {@link RowOptions} relax them.
 */
public final class ObjectMaterializer<T> implements Materializer<T> {
  private final Materializers materializers;
  private final Class<T> type;
  private final Set<RowOptions> options;
  private final ConstructorMetadata constructor;
  private final DesiredColumns desired;

  ObjectMaterializer(Materializers materializers, Class<T> type, Set<RowOptions> options) {
    this.materializers = materializers;
    this.type = type;
    this.options = Set.copyOf(options);
    this.constructor = materializers.constructorFor(type, options.contains(RowOptions.INFER_CONSTRUCTOR));
    this.desired = materializers.desiredColumnsFor(type, constructor);
  }

  @Override
  public DesiredColumns desiredColumns() {
    return desired;
  }

  @Override
  public T fromRows(ExecutionToken source, RowCursor rows) {
    if (!rows.next()) {
      if (options.contains(RowOptions.ALLOW_EMPTY_RESULTS)) return null;
      throw new MissingDataException("No rows were returned for " + type.getSimpleName()
          + " from: " + source.commandText());
    }
    T result = materializers.binderFor(source, type, constructor, rows).bind(rows);
    if (!options.contains(RowOptions.DISCARD_EXTRA_ROWS) && rows.next()) {
      throw new UnexpectedDataException("Expected 1 row for " + type.getSimpleName()
          + " but more were returned from: " + source.commandText());
    }
    return result;
  }
}
