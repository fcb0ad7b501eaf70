package io.doublezero.globalmonitor.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parsesShortForms() {
    assertEquals(Duration.ofMillis(500), Durations.parsePositive("t", "500ms"));
    assertEquals(Duration.ofSeconds(8), Durations.parsePositive("t", "8S"));
    assertEquals(Duration.ofMinutes(1), Durations.parsePositive("t", "1m"));
    assertEquals(Duration.ofHours(2), Durations.parsePositive("t", " 2h "));
  }

  @Test
  void parsesIsoForm() {
    assertEquals(Duration.ofSeconds(90), Durations.parsePositive("t", "pt1m30s"));
  }

  @Test
  void rejectsZeroNegativeAndGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "0ms"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "PT-1S"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "8 seconds"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "99999999999999999999s"));
  }
}
