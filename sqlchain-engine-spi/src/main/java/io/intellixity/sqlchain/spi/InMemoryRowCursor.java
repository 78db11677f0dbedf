package io.intellixity.sqlchain.spi;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link RowCursor} over rows held in memory, e.g. captured results or fixtures.\n
 * Typed getters follow JDBC: NULL reads as 0/false/null, numbers are narrowed as needed.
 */
public final class InMemoryRowCursor implements RowCursor {
  private final List<String> names;
  private final List<Class<?>> types;
  private final List<Object[]> rows;
  private int position = -1;
  private boolean closed;

  public InMemoryRowCursor(List<String> names, List<Class<?>> types, List<Object[]> rows) {
    this.names = List.copyOf(names);
    this.types = List.copyOf(types);
    if (this.names.size() != this.types.size()) throw new IllegalArgumentException("names and types differ in size");
    this.rows = new ArrayList<>(rows.size());
    for (Object[] r : rows) {
      if (r.length != this.names.size()) throw new IllegalArgumentException("row width " + r.length + " != " + names.size());
      this.rows.add(r.clone());
    }
  }

  public boolean isClosed() { return closed; }

  @Override
  public boolean next() {
    if (closed) throw new IllegalStateException("cursor is closed");
    if (position + 1 >= rows.size()) {
      position = rows.size();
      return false;
    }
    position++;
    return true;
  }

  @Override public int fieldCount() { return names.size(); }
  @Override public String name(int index) { return names.get(index); }
  @Override public Class<?> fieldType(int index) { return types.get(index); }
  @Override public boolean isNull(int index) { return value(index) == null; }

  @Override
  public boolean getBoolean(int index) {
    Object v = value(index);
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) return n.intValue() != 0;
    return Boolean.parseBoolean(v.toString());
  }

  @Override public byte getByte(int index) { return number(index).byteValue(); }
  @Override public short getShort(int index) { return number(index).shortValue(); }
  @Override public int getInt(int index) { return number(index).intValue(); }
  @Override public long getLong(int index) { return number(index).longValue(); }
  @Override public float getFloat(int index) { return number(index).floatValue(); }
  @Override public double getDouble(int index) { return number(index).doubleValue(); }

  @Override
  public String getString(int index) {
    Object v = value(index);
    return v == null ? null : v.toString();
  }

  @Override
  public BigDecimal getBigDecimal(int index) {
    Object v = value(index);
    if (v == null) return null;
    if (v instanceof BigDecimal d) return d;
    return new BigDecimal(v.toString());
  }

  @Override
  public byte[] getBytes(int index) {
    Object v = value(index);
    return v == null ? null : ((byte[]) v).clone();
  }

  @Override public Object getObject(int index) { return value(index); }

  @Override
  public void close() {
    closed = true;
  }

  private Number number(int index) {
    Object v = value(index);
    if (v == null) return 0;
    if (v instanceof Number n) return n;
    if (v instanceof Boolean b) return b ? 1 : 0;
    return new BigDecimal(v.toString());
  }

  private Object value(int index) {
    Objects.checkIndex(index, names.size());
    if (position < 0 || position >= rows.size()) throw new IllegalStateException("cursor is not on a row");
    return rows.get(position)[index];
  }
}
