package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.MappingException;
import io.intellixity.sqlchain.jdbc.materialize.Fixtures.Status;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class ValueConverterTest {
  @Test
  void nullBecomesThePrimitiveDefault() {
    assertEquals(0, ValueConverter.convert(null, int.class));
    assertEquals(false, ValueConverter.convert(null, boolean.class));
    assertNull(ValueConverter.convert(null, Integer.class));
  }

  @Test
  void numbersWidenAndNarrow() {
    assertEquals(5, ValueConverter.convert(5L, int.class));
    assertEquals(5L, ValueConverter.convert(5, Long.class));
    assertEquals(new BigDecimal("12"), ValueConverter.convert(12, BigDecimal.class));
    assertEquals(BigInteger.TEN, ValueConverter.convert(new BigDecimal("10.7"), BigInteger.class));
    assertEquals(42, ValueConverter.convert(" 42 ", Integer.class));
    assertThrows(MappingException.class, () -> ValueConverter.convert("4x", Integer.class));
  }

  @Test
  void booleansFromNumbersAndText() {
    assertEquals(true, ValueConverter.convert(1, boolean.class));
    assertEquals(false, ValueConverter.convert("FALSE", Boolean.class));
    assertThrows(MappingException.class, () -> ValueConverter.convert("maybe", Boolean.class));
  }

  @Test
  void enumsByNameOrOrdinal() {
    assertEquals(Status.SUSPENDED, ValueConverter.convert("suspended", Status.class));
    assertEquals(Status.ACTIVE, ValueConverter.convert(0, Status.class));
    assertThrows(MappingException.class, () -> ValueConverter.convert(9, Status.class));
  }

  @Test
  void uuidsFromTextAndBytes() {
    UUID id = UUID.randomUUID();
    byte[] bytes = ByteBuffer.allocate(16).putLong(id.getMostSignificantBits()).putLong(id.getLeastSignificantBits())
        .array();
    assertEquals(id, ValueConverter.convert(id.toString(), UUID.class));
    assertEquals(id, ValueConverter.convert(bytes, UUID.class));
  }

  @Test
  void temporalsFromJdbcTypesAndIsoText() {
    LocalDateTime at = LocalDateTime.of(2024, 3, 1, 12, 30);
    assertEquals(at, ValueConverter.convert(Timestamp.valueOf(at), LocalDateTime.class));
    assertEquals(at, ValueConverter.convert("2024-03-01 12:30:00", LocalDateTime.class));
    assertEquals(LocalDate.of(2024, 3, 1), ValueConverter.convert("2024-03-01", LocalDate.class));
  }

  @Test
  void unsupportedTargetsFail() {
    MappingException e = assertThrows(MappingException.class, () -> ValueConverter.convert(new Object(), Status.class));
    assertTrue(e.getMessage().startsWith("Cannot convert"), e.getMessage());
    assertThrows(MappingException.class, () -> ValueConverter.convert(new byte[] {1}, String.class));
  }
}
