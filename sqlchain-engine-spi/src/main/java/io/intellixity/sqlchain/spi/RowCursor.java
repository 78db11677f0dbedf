package io.intellixity.sqlchain.spi;

import java.math.BigDecimal;

/**
 * Forward-only view of a result.\n
 *
 * Column indexes are 0-based. Primitive getters return 0/false for NULL; check {@link #isNull(int)} first
 * when the difference matters.
 */
public interface RowCursor extends AutoCloseable {
  /** Advances to the next row; false at the end. */
  boolean next();

  int fieldCount();

  String name(int index);

  /** Java type the driver reports for the column. */
  Class<?> fieldType(int index);

  boolean isNull(int index);

  boolean getBoolean(int index);

  byte getByte(int index);

  short getShort(int index);

  int getInt(int index);

  long getLong(int index);

  float getFloat(int index);

  double getDouble(int index);

  String getString(int index);

  BigDecimal getBigDecimal(int index);

  byte[] getBytes(int index);

  Object getObject(int index);

  @Override
  void close();
}
