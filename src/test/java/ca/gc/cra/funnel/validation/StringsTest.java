package ca.gc.cra.funnel.validation;

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
  void requireChannelNameAcceptsDottedSegments() {
    assertEquals("app.db-pool.$1", Strings.requireChannelName("channel", "app.db-pool.$1"));
  }

  @Test
  void requireChannelNameRejectsEmptySegments() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelName("channel", "app..db"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelName("channel", ".app"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelName("channel", "app db"));
  }
}
