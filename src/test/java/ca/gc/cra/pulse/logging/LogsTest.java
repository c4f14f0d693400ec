package ca.gc.cra.pulse.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    String value = "start_test 6869";
    assertSame(value, Logs.truncate(value, 64));
    assertEquals("<null>", Logs.truncate(null, 4));
  }

  @Test
  void truncateReportsOriginalLength() {
    assertEquals("abcd? (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateDropsSplitCodepoint() {
    String truncated = Logs.truncate("aéb", 2);

    assertTrue(truncated.startsWith("a?"), truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void rowsSplitAtFixedWidth() {
    List<String> rows = Logs.rows("x".repeat(Logs.ROW_WIDTH + 5));

    assertEquals(2, rows.size());
    assertEquals(5, rows.get(1).length());
  }

  @Test
  void excerptLabelsBothHalves() {
    String excerpt = Logs.excerpt("6869", "zz");

    assertTrue(excerpt.contains("Before:" + System.lineSeparator() + "    6869"));
    assertTrue(excerpt.contains("After:" + System.lineSeparator() + "    zz"));
  }
}
