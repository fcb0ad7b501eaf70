package io.doublezero.globalmonitor.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(42, Numbers.parseInt("n", " 42 ", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("n", "4x", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("n", "101", 1, 100));
  }
}
