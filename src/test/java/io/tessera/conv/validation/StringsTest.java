package io.tessera.conv.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsValue() {
    assertEquals("value", Strings.requireNonBlank("field", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
  }

  @Test
  void requireIdentifierAcceptsSafeCharacters() {
    assertEquals("m01.left-arm_2", Strings.requireIdentifier("stream", "m01.left-arm_2"));
  }

  @Test
  void requireIdentifierRejectsSeparators() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("stream", "ecog/raw"));
    assertTrue(ex.getMessage().startsWith("stream must only contain"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("stream", "two words"));
  }

  @Test
  void requireDatasetPathStripsOuterSlashes() {
    assertEquals("ecog/samples", Strings.requireDatasetPath("dataset", "/ecog/samples/"));
    assertEquals("samples", Strings.requireDatasetPath("dataset", "samples"));
  }

  @Test
  void requireDatasetPathRejectsTraversalAndEmptySegments() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "ecog/../etc"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "ecog//samples"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "/"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "ecog/./samples"));
  }
}
