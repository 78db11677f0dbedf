package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.spi.RowCursor;

import java.math.BigDecimal;

/**
 * Typed accessor chosen from the type of the property receiving a column.\n
 *
 * The reader never depends on the class a driver reports for a column, which may change from row to row.
 * Numeric targets get a typed getter; everything else is read with {@code getObject} and converted.
 */
enum ColumnReader {
  BYTE(Byte.class) {
    @Override Object read(RowCursor row, int index) { return row.getByte(index); }
  },
  SHORT(Short.class) {
    @Override Object read(RowCursor row, int index) { return row.getShort(index); }
  },
  INT(Integer.class) {
    @Override Object read(RowCursor row, int index) { return row.getInt(index); }
  },
  LONG(Long.class) {
    @Override Object read(RowCursor row, int index) { return row.getLong(index); }
  },
  FLOAT(Float.class) {
    @Override Object read(RowCursor row, int index) { return row.getFloat(index); }
  },
  DOUBLE(Double.class) {
    @Override Object read(RowCursor row, int index) { return row.getDouble(index); }
  },
  BIG_DECIMAL(BigDecimal.class) {
    @Override Object read(RowCursor row, int index) { return row.getBigDecimal(index); }
  },
  OBJECT(Object.class) {
    @Override Object read(RowCursor row, int index) { return row.getObject(index); }
  };

  private final Class<?> resultType;

  ColumnReader(Class<?> resultType) {
    this.resultType = resultType;
  }

  abstract Object read(RowCursor row, int index);

  /** Boxed type {@link #read} returns. */
  Class<?> resultType() { return resultType; }

  static ColumnReader forTarget(Class<?> targetType) {
    Class<?> t = ValueConverter.wrap(targetType);
    if (t == Byte.class) return BYTE;
    if (t == Short.class) return SHORT;
    if (t == Integer.class) return INT;
    if (t == Long.class) return LONG;
    if (t == Float.class) return FLOAT;
    if (t == Double.class) return DOUBLE;
    if (t == BigDecimal.class) return BIG_DECIMAL;
    return OBJECT;
  }
}
