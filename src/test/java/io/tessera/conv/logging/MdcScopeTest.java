package io.tessera.conv.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcScopeTest {

  @AfterEach
  void clear() {
    MDC.clear();
  }

  @Test
  void removesKeysThatWereAbsent() {
    try (MdcScope scope = MdcScope.of(MdcScope.SESSION, "m01_2024-03-01_1").and(MdcScope.STREAM, "ecog")) {
      assertEquals("m01_2024-03-01_1", MDC.get(MdcScope.SESSION));
      assertEquals("ecog", MDC.get(MdcScope.STREAM));
    }
    assertNull(MDC.get(MdcScope.SESSION));
    assertNull(MDC.get(MdcScope.STREAM));
  }

  @Test
  void nestedScopesRestoreOuterValues() {
    try (MdcScope outer = MdcScope.of(MdcScope.SESSION, "s1").and(MdcScope.STREAM, "ecog")) {
      try (MdcScope inner = MdcScope.of(MdcScope.STREAM, "cursor")) {
        assertEquals("cursor", MDC.get(MdcScope.STREAM));
        assertEquals("s1", MDC.get(MdcScope.SESSION));
      }
      assertEquals("ecog", MDC.get(MdcScope.STREAM));
    }
    assertNull(MDC.get(MdcScope.STREAM));
  }

  @Test
  void repeatedKeyRestoresFirstPreviousValue() {
    MDC.put(MdcScope.STREAM, "original");
    try (MdcScope scope = MdcScope.of(MdcScope.STREAM, "a").and(MdcScope.STREAM, "b")) {
      assertEquals("b", MDC.get(MdcScope.STREAM));
    }
    assertEquals("original", MDC.get(MdcScope.STREAM));
  }
}
