package io.intellixity.sqlchain.jdbc.sqlserver;

import io.intellixity.sqlchain.spi.CommandParameter;
import io.intellixity.sqlchain.spi.CommandType;
import io.intellixity.sqlchain.spi.InMemoryRowCursor;
import io.intellixity.sqlchain.spi.NativeCommand;
import io.intellixity.sqlchain.spi.NativeCommandFactory;
import io.intellixity.sqlchain.spi.RowCursor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Answers catalog queries from canned rows chosen by the bound arguments. */
final class ScriptedCatalog implements NativeCommandFactory {
  private final Map<String, List<String>> columns = new HashMap<>();
  private final Map<String, Function<List<Object>, List<Object[]>>> answers = new HashMap<>();
  final List<String> executed = new CopyOnWriteArrayList<>();

  static Object[] row(Object... values) {
    return values;
  }

  static List<Object[]> rows(Object[]... rows) {
    return Arrays.asList(rows);
  }

  ScriptedCatalog on(String sql, List<String> columnNames, Function<List<Object>, List<Object[]>> rows) {
    columns.put(sql, columnNames);
    answers.put(sql, rows);
    return this;
  }

  @Override
  public NativeCommand create(String commandText, CommandType commandType, List<CommandParameter> parameters,
                              Duration timeout) {
    Function<List<Object>, List<Object[]>> answer = answers.get(commandText);
    if (answer == null) throw new AssertionError("unexpected catalog query: " + commandText);
    List<Object> args = new ArrayList<>();
    for (CommandParameter p : parameters) args.add(p.value());
    return new NativeCommand() {
      @Override
      public RowCursor executeQuery() {
        executed.add(commandText);
        List<String> names = columns.get(commandText);
        return new InMemoryRowCursor(names, Collections.nCopies(names.size(), Object.class), answer.apply(args));
      }

      @Override
      public Integer executeUpdate() {
        throw new UnsupportedOperationException("catalog queries only");
      }

      @Override public void cancel() {}
      @Override public void close() {}
    };
  }
}
