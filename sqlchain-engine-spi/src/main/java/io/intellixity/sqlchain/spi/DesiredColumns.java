package io.intellixity.sqlchain.spi;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Columns a materializer wants back: every column, no column at all, or a named subset.
 */
public final class DesiredColumns {
  private static final DesiredColumns ALL = new DesiredColumns(true, false, List.of());
  private static final DesiredColumns NONE = new DesiredColumns(false, true, List.of());

  private final boolean all;
  private final boolean none;
  private final List<String> names;

  private DesiredColumns(boolean all, boolean none, List<String> names) {
    this.all = all;
    this.none = none;
    this.names = names;
  }

  public static DesiredColumns all() { return ALL; }

  /** No read-back: no SELECT or output clause is generated and no row cursor is expected. */
  public static DesiredColumns none() { return NONE; }

  public static DesiredColumns of(String... names) {
    return of(List.of(names));
  }

  public static DesiredColumns of(Collection<String> names) {
    Objects.requireNonNull(names, "names");
    if (names.isEmpty()) throw new IllegalArgumentException("names is empty; use DesiredColumns.none()");
    return new DesiredColumns(false, false, List.copyOf(new LinkedHashSet<>(names)));
  }

  public boolean isAll() { return all; }

  public boolean isNone() { return none; }

  /** Requested names in order, empty for {@link #all()} and {@link #none()}. */
  public List<String> names() { return names; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DesiredColumns that)) return false;
    return all == that.all && none == that.none && names.equals(that.names);
  }

  @Override
  public int hashCode() {
    return Objects.hash(all, none, names);
  }

  @Override
  public String toString() {
    if (all) return "DesiredColumns[*]";
    if (none) return "DesiredColumns[none]";
    return "DesiredColumns" + names;
  }
}
