package io.intellixity.sqlchain.jdbc.dialect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QualifiedNamesTest {
  @Test
  void splitsPlainAndQuotedParts() {
    assertEquals(List.of("Customer"), QualifiedNames.split(" Customer ", '"', '"'));
    assertEquals(List.of("sales", "Customer"), QualifiedNames.split("sales.Customer", '"', '"'));
    assertEquals(List.of("dbo", "Order Lines"), QualifiedNames.split("[dbo].[Order Lines]", '[', ']'));
    assertEquals(List.of("a.b", "c]d"), QualifiedNames.split("[a.b] . [c]]d]", '[', ']'));
    assertEquals(List.of("we\"ird"), QualifiedNames.split("\"we\"\"ird\"", '"', '"'));
  }

  @Test
  void rejectsMalformedNames() {
    assertThrows(IllegalArgumentException.class, () -> QualifiedNames.split("", '"', '"'));
    assertThrows(IllegalArgumentException.class, () -> QualifiedNames.split("a..b", '"', '"'));
    assertThrows(IllegalArgumentException.class, () -> QualifiedNames.split("[dbo", '[', ']'));
    assertThrows(IllegalArgumentException.class, () -> QualifiedNames.split("[dbo]x.y", '[', ']'));
  }
}
