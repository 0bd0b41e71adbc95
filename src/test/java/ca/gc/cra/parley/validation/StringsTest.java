package ca.gc.cra.parley.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("config", Strings.requireNonBlank("name", "  config "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void parseBooleanIsStrict() {
    assertEquals(Boolean.TRUE, Strings.parseBoolean(" TRUE "));
    assertEquals(Boolean.FALSE, Strings.parseBoolean("false"));
    assertNull(Strings.parseBoolean("yes"));
    assertNull(Strings.parseBoolean(null));
  }
}
