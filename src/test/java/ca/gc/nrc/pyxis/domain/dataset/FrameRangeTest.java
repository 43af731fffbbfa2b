package ca.gc.nrc.pyxis.domain.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FrameRangeTest {

  @Test
  void lengthIsHalfOpen() {
    assertEquals(3, new FrameRange(2, 5).length());
    assertEquals(1, FrameRange.single(7).length());
    assertTrue(FrameRange.all(0).isEmpty());
  }

  @Test
  void rejectsInvertedOrNegativeRanges() {
    assertThrows(IllegalArgumentException.class, () -> new FrameRange(-1, 2));
    assertThrows(IllegalArgumentException.class, () -> new FrameRange(5, 4));
  }
}
