package ca.gc.cra.radcorr.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsInclusiveBounds() {
    assertEquals(1, Numbers.requireRange("chunkSize", 1, 1, 10));
    assertEquals(10, Numbers.requireRange("chunkSize", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutOfBoundsWithName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("chunkSize", 0, 1, 10));
    assertTrue(ex.getMessage().startsWith("chunkSize must be between 1 and 10"));
  }

  @Test
  void requirePositiveFiniteRejectsZeroNaNAndInfinity() {
    assertEquals(2.5, Numbers.requirePositiveFinite("scale", 2.5));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositiveFinite("scale", 0.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositiveFinite("scale", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requirePositiveFinite("scale", Double.POSITIVE_INFINITY));
  }

  @Test
  void parsersTrimAndReportLabel() {
    assertEquals(42L, Numbers.parseLong("band", " 42 "));
    assertEquals(0.25, Numbers.parseDouble("wavelength", "0.25"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("", "x"));
    assertTrue(ex.getMessage().startsWith("value must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("wavelength", "blue"));
  }
}
