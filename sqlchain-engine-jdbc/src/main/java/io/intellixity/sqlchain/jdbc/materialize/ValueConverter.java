package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Converts values read from a row into the type of the property or parameter receiving them.\n
 *
 * NULL into a primitive yields that primitive's default. Both binder tiers convert through here.
 */
public final class ValueConverter {
  private ValueConverter() {}

  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class,
      char.class, Character.class);

  private static final Map<Class<?>, Object> DEFAULTS = Map.of(
      boolean.class, false,
      byte.class, (byte) 0,
      short.class, (short) 0,
      int.class, 0,
      long.class, 0L,
      float.class, 0f,
      double.class, 0d,
      char.class, '\0');

  public static Class<?> wrap(Class<?> type) {
    return type.isPrimitive() ? WRAPPERS.get(type) : type;
  }

  public static Object defaultValue(Class<?> type) {
    return type.isPrimitive() ? DEFAULTS.get(type) : null;
  }

  public static Object convert(Object value, Class<?> target) {
    if (value == null) return defaultValue(target);
    Class<?> t = wrap(target);
    if (t.isInstance(value)) return value;

    if (t == String.class) return stringOf(value);
    if (value instanceof Number n && Number.class.isAssignableFrom(t)) return number(n, t);
    if (value instanceof String s && Number.class.isAssignableFrom(t)) return number(parseNumber(s, t), t);
    if (t == Boolean.class) return bool(value);
    if (t == Character.class && value instanceof String s && s.length() == 1) return s.charAt(0);
    if (t.isEnum()) return enumOf(value, t);
    if (t == UUID.class) return uuid(value);

    Object temporal = temporal(value, t);
    if (temporal != null) return temporal;

    throw new MappingException("Cannot convert " + value.getClass().getName() + " to " + target.getName());
  }

  private static String stringOf(Object value) {
    if (value instanceof byte[]) {
      throw new MappingException("Cannot convert byte[] to java.lang.String");
    }
    return value.toString();
  }

  private static Object number(Number n, Class<?> t) {
    if (t == Integer.class) return n.intValue();
    if (t == Long.class) return n.longValue();
    if (t == Short.class) return n.shortValue();
    if (t == Byte.class) return n.byteValue();
    if (t == Double.class) return n.doubleValue();
    if (t == Float.class) return n.floatValue();
    if (t == BigDecimal.class) {
      if (n instanceof BigInteger bi) return new BigDecimal(bi);
      if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
      return BigDecimal.valueOf(n.longValue());
    }
    if (t == BigInteger.class) {
      if (n instanceof BigDecimal bd) return bd.toBigInteger();
      return BigInteger.valueOf(n.longValue());
    }
    throw new MappingException("Cannot convert " + n.getClass().getName() + " to " + t.getName());
  }

  private static Number parseNumber(String s, Class<?> t) {
    try {
      String v = s.trim();
      if (t == Double.class || t == Float.class) return Double.parseDouble(v);
      if (t == BigInteger.class) return new BigInteger(v);
      if (t == BigDecimal.class) return new BigDecimal(v);
      return Long.parseLong(v);
    } catch (NumberFormatException e) {
      throw new MappingException("Cannot convert '" + s + "' to " + t.getName(), e);
    }
  }

  private static Boolean bool(Object value) {
    if (value instanceof Number n) return n.longValue() != 0;
    if (value instanceof String s) {
      String v = s.trim();
      if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
      if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
    }
    throw new MappingException("Cannot convert " + value + " to java.lang.Boolean");
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Object enumOf(Object value, Class<?> t) {
    Class<? extends Enum> et = (Class<? extends Enum>) t;
    if (value instanceof String s) {
      for (Enum c : et.getEnumConstants()) {
        if (c.name().equalsIgnoreCase(s.trim())) return c;
      }
      throw new MappingException("No constant " + s + " in " + t.getName());
    }
    if (value instanceof Number n) {
      Enum[] constants = et.getEnumConstants();
      int i = n.intValue();
      if (i < 0 || i >= constants.length) throw new MappingException("No ordinal " + i + " in " + t.getName());
      return constants[i];
    }
    throw new MappingException("Cannot convert " + value.getClass().getName() + " to " + t.getName());
  }

  private static UUID uuid(Object value) {
    if (value instanceof String s) return UUID.fromString(s.trim());
    if (value instanceof byte[] b && b.length == 16) {
      ByteBuffer bb = ByteBuffer.wrap(b);
      return new UUID(bb.getLong(), bb.getLong());
    }
    throw new MappingException("Cannot convert " + value.getClass().getName() + " to java.util.UUID");
  }

  private static Object temporal(Object value, Class<?> t) {
    if (t == LocalDate.class) {
      if (value instanceof java.sql.Date d) return d.toLocalDate();
      if (value instanceof java.sql.Timestamp ts) return ts.toLocalDateTime().toLocalDate();
      if (value instanceof String s) return LocalDate.parse(s.trim());
    } else if (t == LocalDateTime.class) {
      if (value instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
      if (value instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay();
      if (value instanceof String s) return LocalDateTime.parse(s.trim().replace(' ', 'T'));
    } else if (t == LocalTime.class) {
      if (value instanceof java.sql.Time tm) return tm.toLocalTime();
      if (value instanceof String s) return LocalTime.parse(s.trim());
    } else if (t == Instant.class) {
      if (value instanceof java.sql.Timestamp ts) return ts.toInstant();
      if (value instanceof OffsetDateTime odt) return odt.toInstant();
      if (value instanceof String s) return Instant.parse(s.trim());
    } else if (t == OffsetDateTime.class) {
      if (value instanceof String s) return OffsetDateTime.parse(s.trim());
    }
    return null;
  }
}
