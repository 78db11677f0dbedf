package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.jdbc.cache.ResultCache;
import io.intellixity.sqlchain.jdbc.dialect.SqlCommandBuilder;
import io.intellixity.sqlchain.jdbc.materialize.Materializers;
import io.intellixity.sqlchain.op.DeleteDescriptor;
import io.intellixity.sqlchain.op.InsertDescriptor;
import io.intellixity.sqlchain.op.SelectDescriptor;
import io.intellixity.sqlchain.op.UpdateDescriptor;
import io.intellixity.sqlchain.op.UpsertDescriptor;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Prepare-then-execute for each operation, shared by plain and transactional data sources.\n
 * Every operation has an asynchronous form that builds its statement on the calling thread and runs it on the
 * async executor.
 *
 * @param <N> the dialect's object name type
 */
public interface SqlOperations<N> {
  SqlCommandBuilder<N> builder();

  Materializers materializers();

  ResultCache resultCache();

  <R> R execute(ExecutionToken token, Materializer<R> materializer);

  <R> CompletableFuture<R> executeAsync(ExecutionToken token, Materializer<R> materializer);

  default <R> R select(SelectDescriptor d, Materializer<R> materializer) {
    return execute(builder().prepareSelect(d, materializer), materializer);
  }

  /** Builds the statement on the calling thread; only execution and row fetching are asynchronous. */
  default <R> CompletableFuture<R> selectAsync(SelectDescriptor d, Materializer<R> materializer) {
    return executeAsync(builder().prepareSelect(d, materializer), materializer);
  }

  default <R> R insert(InsertDescriptor d, Materializer<R> materializer) {
    return execute(builder().prepareInsert(d, materializer), materializer);
  }

  default <R> CompletableFuture<R> insertAsync(InsertDescriptor d, Materializer<R> materializer) {
    return executeAsync(builder().prepareInsert(d, materializer), materializer);
  }

  default <R> R update(UpdateDescriptor d, Materializer<R> materializer) {
    return execute(builder().prepareUpdate(d, materializer), materializer);
  }

  default <R> CompletableFuture<R> updateAsync(UpdateDescriptor d, Materializer<R> materializer) {
    return executeAsync(builder().prepareUpdate(d, materializer), materializer);
  }

  default <R> R upsert(UpsertDescriptor d, Materializer<R> materializer) {
    return execute(builder().prepareUpsert(d, materializer), materializer);
  }

  default <R> CompletableFuture<R> upsertAsync(UpsertDescriptor d, Materializer<R> materializer) {
    return executeAsync(builder().prepareUpsert(d, materializer), materializer);
  }

  default <R> R delete(DeleteDescriptor d, Materializer<R> materializer) {
    return execute(builder().prepareDelete(d, materializer), materializer);
  }

  default <R> CompletableFuture<R> deleteAsync(DeleteDescriptor d, Materializer<R> materializer) {
    return executeAsync(builder().prepareDelete(d, materializer), materializer);
  }

  // ---- result cache ----

  /** Runs the select and stores a non-null result under {@code cacheKey}, replacing any earlier entry. */
  default <R> R selectAndCache(SelectDescriptor d, Materializer<R> materializer, String cacheKey, Duration timeToLive) {
    R result = select(d, materializer);
    resultCache().put(cacheKey, result, timeToLive);
    return result;
  }

  /** The result cached under {@code cacheKey}; on a miss, runs the select and caches its result. */
  @SuppressWarnings("unchecked")
  default <R> R readOrSelect(String cacheKey, SelectDescriptor d, Materializer<R> materializer, Duration timeToLive) {
    Optional<Object> cached = resultCache().get(cacheKey);
    if (cached.isPresent()) return (R) cached.get();
    return selectAndCache(d, materializer, cacheKey, timeToLive);
  }

  default void invalidateCache(String cacheKey) {
    resultCache().invalidate(cacheKey);
  }
}
