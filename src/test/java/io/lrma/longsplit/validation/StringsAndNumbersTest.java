package io.lrma.longsplit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsAndNumbersTest {

  @Test
  void tagKeysAreTwoCharacters() {
    assertEquals("SG", Strings.requireTagKey("segmentsTag", " SG "));
    assertEquals("x1", Strings.requireTagKey("segmentsTag", "x1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireTagKey("segmentsTag", "SEG"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireTagKey("segmentsTag", "1G"));
  }

  @Test
  void nonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("model", "mas\u000015"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("model", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("model", null));
  }

  @Test
  void printableAsciiEnforcesLength() {
    assertEquals("a=b", Strings.requirePrintableAscii("attrs", "a=b", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a=bc", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "é=1", 10));
  }

  @Test
  void parseIntChecksFormatAndRange() {
    assertEquals(8, Numbers.parseInt("threads", " 8 ", 0, 16));
    IllegalArgumentException notNumber =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("threads", "eight", 0, 16));
    assertEquals("threads must be an integer (was 'eight')", notNumber.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("threads", "17", 0, 16));
  }
}
