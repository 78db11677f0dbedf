package io.intellixity.sqlchain.jdbc;

import io.intellixity.sqlchain.spi.RowCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/**
 * {@link RowCursor} over a JDBC {@link ResultSet}. Indexes are translated from 0-based to JDBC's 1-based.
 */
public final class JdbcRowCursor implements RowCursor {
  private static final Logger log = LoggerFactory.getLogger(JdbcRowCursor.class);

  private final ResultSet rs;
  private final String commandText;
  private final String[] names;
  private final Class<?>[] types;

  public JdbcRowCursor(ResultSet rs, String commandText) {
    this.rs = rs;
    this.commandText = commandText;
    try {
      ResultSetMetaData md = rs.getMetaData();
      int n = md.getColumnCount();
      this.names = new String[n];
      this.types = new Class<?>[n];
      for (int i = 0; i < n; i++) {
        names[i] = md.getColumnLabel(i + 1);
        types[i] = columnType(md, i + 1);
      }
    } catch (SQLException e) {
      throw new UncheckedSqlException(commandText, e);
    }
  }

  @Override
  public boolean next() {
    try {
      return rs.next();
    } catch (SQLException e) {
      throw fail(e);
    }
  }

  @Override public int fieldCount() { return names.length; }
  @Override public String name(int index) { return names[index]; }
  @Override public Class<?> fieldType(int index) { return types[index]; }

  @Override
  public boolean isNull(int index) {
    try {
      return rs.getObject(index + 1) == null;
    } catch (SQLException e) {
      throw fail(e);
    }
  }

  @Override
  public boolean getBoolean(int index) {
    try { return rs.getBoolean(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public byte getByte(int index) {
    try { return rs.getByte(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public short getShort(int index) {
    try { return rs.getShort(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public int getInt(int index) {
    try { return rs.getInt(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public long getLong(int index) {
    try { return rs.getLong(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public float getFloat(int index) {
    try { return rs.getFloat(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public double getDouble(int index) {
    try { return rs.getDouble(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public String getString(int index) {
    try { return rs.getString(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public BigDecimal getBigDecimal(int index) {
    try { return rs.getBigDecimal(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public byte[] getBytes(int index) {
    try { return rs.getBytes(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public Object getObject(int index) {
    try { return rs.getObject(index + 1); } catch (SQLException e) { throw fail(e); }
  }

  @Override
  public void close() {
    try {
      rs.close();
    } catch (SQLException e) {
      throw fail(e);
    }
  }

  private UncheckedSqlException fail(SQLException e) {
    return new UncheckedSqlException(commandText, e);
  }

  /** Reported Java type of a column; drivers that cannot tell before the first row yield {@code Object}. */
  private Class<?> columnType(ResultSetMetaData md, int column) {
    try {
      return loadType(md.getColumnClassName(column));
    } catch (SQLException e) {
      if (log.isDebugEnabled()) {
        log.debug("sqlchain.jdbc op=column_type column={} sql={} error={}", column, commandText, e.getMessage());
      }
      return Object.class;
    }
  }

  private static Class<?> loadType(String className) {
    if (className == null) return Object.class;
    if ("[B".equals(className) || "byte[]".equals(className)) return byte[].class;
    try {
      return Class.forName(className, false, JdbcRowCursor.class.getClassLoader());
    } catch (ClassNotFoundException e) {
      // vendor type not visible here; rows are still readable through getObject
      return Object.class;
    }
  }
}
