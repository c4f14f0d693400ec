package ca.gc.cra.pulse.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("sentinel", "   "));
    assertEquals("sentinel must not be blank", ex.getMessage());
  }

  @Test
  void printableTokenAcceptsSentinel() {
    assertEquals("<<--PULSE-PIPE-->>:", Strings.requirePrintableToken("sentinel", "<<--PULSE-PIPE-->>:", 64));
  }

  @Test
  void printableTokenRejectsInnerSpaceAndNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableToken("sentinel", "a b", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableToken("sentinel", "v☃l", 16));
  }

  @Test
  void printableTokenRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableToken("sentinel", "abc", 2));
  }
}
