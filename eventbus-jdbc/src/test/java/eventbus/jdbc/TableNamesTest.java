package eventbus.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals("event_record", TableNames.validate("event_record"));
    assertEquals("_Events2", TableNames.validate("_Events2"));
  }

  @Test
  void rejectsAnythingElse() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2events"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("app.events"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }
}
