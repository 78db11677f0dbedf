package io.intellixity.sqlchain.op;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Insert-or-update of one row.\n
 * Rows are matched on the primary key, on {@code @Key} properties, or on explicit {@code matchColumns}.
 */
public record UpsertDescriptor(String tableName, Object argumentValue, List<String> matchColumns, Set<UpsertOptions> options) {
  public UpsertDescriptor {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(argumentValue, "argumentValue");
    matchColumns = (matchColumns == null) ? List.of() : List.copyOf(matchColumns);
    options = (options == null || options.isEmpty()) ? Set.of() : Set.copyOf(options);
  }

  public static UpsertDescriptor of(String tableName, Object argumentValue, UpsertOptions... options) {
    Set<UpsertOptions> opts = EnumSet.noneOf(UpsertOptions.class);
    opts.addAll(List.of(options));
    return new UpsertDescriptor(tableName, argumentValue, List.of(), opts);
  }

  public UpsertDescriptor withMatchColumns(String... columns) {
    return new UpsertDescriptor(tableName, argumentValue, List.of(columns), options);
  }

  public boolean has(UpsertOptions option) {
    return options.contains(option);
  }
}
