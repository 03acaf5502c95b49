package ca.gc.cra.dualtap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
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
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("markerValue", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("markerValue", "abc", 2));
  }

  @Test
  void requireHeaderNameAcceptsTokens() {
    assertEquals("X-MITM-Agent", Strings.requireHeaderName("markerHeader", " X-MITM-Agent "));
  }

  @Test
  void requireHeaderNameRejectsSeparators() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHeaderName("markerHeader", "X Agent"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHeaderName("markerHeader", "X:Agent"));
  }

  @Test
  void splitListTrimsDropsBlanksAndDuplicates() {
    assertEquals(List.of("dawn.com", "www.dawn.com"),
        Strings.splitList("targetDomains", " dawn.com, ,www.dawn.com,dawn.com"));
    assertEquals(List.of(), Strings.splitList("targetDomains", null));
  }
}
