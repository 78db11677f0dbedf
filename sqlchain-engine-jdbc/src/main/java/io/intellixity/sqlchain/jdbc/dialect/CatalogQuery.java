package io.intellixity.sqlchain.jdbc.dialect;

import io.intellixity.sqlchain.spi.CommandParameter;
import io.intellixity.sqlchain.spi.CommandType;
import io.intellixity.sqlchain.spi.NativeCommand;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.RowCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs catalog queries for metadata caches.\n
 * Each call is one native command; command and cursor are closed before returning.
 */
public final class CatalogQuery {
  private static final Logger log = LoggerFactory.getLogger(CatalogQuery.class);
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final NativeCommandFactory commands;

  public CatalogQuery(NativeCommandFactory commands) {
    this.commands = Objects.requireNonNull(commands, "commands");
  }

  /** Maps every row of {@code sql}; {@code args} bind positionally to its {@code ?} placeholders. */
  public <T> List<T> list(String sql, Function<RowCursor, T> mapper, Object... args) {
    List<CommandParameter> params = new ArrayList<>(args.length);
    for (int i = 0; i < args.length; i++) params.add(new CommandParameter("p" + (i + 1), args[i]));
    if (log.isTraceEnabled()) log.trace("sqlchain.metadata op=query sql={} params={}", sql, params.size());

    List<T> out = new ArrayList<>();
    try (NativeCommand cmd = commands.create(sql, CommandType.TEXT, params, TIMEOUT);
         RowCursor rows = cmd.executeQuery()) {
      while (rows.next()) out.add(mapper.apply(rows));
    }
    return out;
  }

  /** First mapped row, or {@code null} when there is none. */
  public <T> T first(String sql, Function<RowCursor, T> mapper, Object... args) {
    List<T> rows = list(sql, mapper, args);
    return rows.isEmpty() ? null : rows.get(0);
  }
}
